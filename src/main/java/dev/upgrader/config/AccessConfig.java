package dev.upgrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared secret and caller allow-list for the /api endpoints.
 * Loaded from application.yml under 'access' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "access")
public class AccessConfig {

    /** Bearer token; blank means every authenticated call is refused. */
    private String token = "";

    /** IPs or CIDR ranges; empty allows every caller. */
    private List<String> allowedIps = new ArrayList<>();
}
