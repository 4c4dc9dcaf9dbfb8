package dev.upgrader.config;

import dev.upgrader.model.RunTarget;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Periodic trigger settings.
 * Loaded from application.yml under 'schedule' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "schedule")
public class ScheduleConfig {

    private boolean enabled = true;
    private String cron = "0 0 * * * *";
    private String zone = "UTC";

    /** movies, episodes or both; the legacy radarr/sonarr names are accepted too. */
    private String target = "both";

    public RunTarget getRunTarget() {
        return RunTarget.fromWire(target);
    }
}
