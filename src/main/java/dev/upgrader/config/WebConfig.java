package dev.upgrader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.upgrader.web.ApiAccessInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Guards every /api endpoint with the access check; /healthz stays open.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AccessConfig accessConfig;
    private final ObjectMapper objectMapper;

    public WebConfig(AccessConfig accessConfig, ObjectMapper objectMapper) {
        this.accessConfig = accessConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiAccessInterceptor(accessConfig, objectMapper))
                .addPathPatterns("/api/**");
    }
}
