package dev.upgrader.error;

import lombok.Getter;

/**
 * A catalog call answered with a non-2xx status that was either not retryable or
 * still failing after the last retry.
 */
@Getter
public class HttpStatusException extends UpgraderException {

    private final int statusCode;
    private final String url;

    public HttpStatusException(String method, String url, int statusCode, String responseBody) {
        super(String.format("%s %s returned HTTP %d%s", method, url, statusCode,
                responseBody == null || responseBody.isBlank() ? "" : ": " + abbreviate(responseBody)));
        this.statusCode = statusCode;
        this.url = url;
    }

    private static String abbreviate(String body) {
        String flat = body.replace('\n', ' ').trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
