package tech.authgate.platform.audit;

/**
 * Network origin of a request, as seen by the HTTP layer.
 */
public record RequestOrigin(String ip, String userAgent) {

    public static final RequestOrigin UNKNOWN = new RequestOrigin(null, null);
}
