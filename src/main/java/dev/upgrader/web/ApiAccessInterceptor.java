package dev.upgrader.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.upgrader.config.AccessConfig;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;

/**
 * Allow-list check, then bearer token check.
 * <p>
 * Rejections are written straight to the response as {@code {"error": ...}} JSON,
 * whatever the request's {@code Accept} header, so an event-stream client gets the
 * same 401/403/503 as any other caller.
 */
@Slf4j
public class ApiAccessInterceptor implements HandlerInterceptor {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    private static final String BEARER_PREFIX = "bearer ";

    private final AccessConfig accessConfig;
    private final ObjectMapper objectMapper;

    public ApiAccessInterceptor(AccessConfig accessConfig, ObjectMapper objectMapper) {
        this.accessConfig = accessConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String caller = clientAddress(request);
        if (!new AddressAllowList(accessConfig.getAllowedIps()).permits(caller)) {
            log.warn("Rejected {} {} from {}: not in allow-list", request.getMethod(), request.getRequestURI(), caller);
            return reject(response, HttpStatus.FORBIDDEN, "Forbidden");
        }

        String expected = accessConfig.getToken();
        if (expected == null || expected.isBlank()) {
            return reject(response, HttpStatus.SERVICE_UNAVAILABLE, "Service token not configured");
        }

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return reject(response, HttpStatus.UNAUTHORIZED, "Missing bearer token");
        }

        String presented = authorization.substring(BEARER_PREFIX.length()).trim();
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {} from {}: invalid token", request.getMethod(), request.getRequestURI(), caller);
            return reject(response, HttpStatus.UNAUTHORIZED, "Invalid token");
        }
        return true;
    }

    private boolean reject(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(Map.of("error", message)));
        return false;
    }

    /**
     * First {@code X-Forwarded-For} entry, else the socket peer.
     */
    static String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
