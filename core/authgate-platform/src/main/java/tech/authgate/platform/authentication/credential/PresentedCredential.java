package tech.authgate.platform.authentication.credential;

import tech.authgate.platform.authentication.TokenIssuer;

/**
 * A credential as presented by a caller, classified by shape alone.
 *
 * Classification decides which validator a value is routed to; it never decides validity.
 * Each validator accepts only its own variants, so a legacy session token can never be
 * introspected as an OAuth token and an OAuth token can never open a legacy session.
 */
public sealed interface PresentedCredential {

    /**
     * Raw value as received.
     */
    String raw();

    /**
     * Signed legacy session token (three dot-separated JWT segments).
     */
    record LegacySession(String raw) implements PresentedCredential {}

    /**
     * Opaque legacy refresh token.
     */
    record LegacyRefresh(String raw) implements PresentedCredential {}

    record OAuthAccess(String raw) implements PresentedCredential {}

    record OAuthRefresh(String raw) implements PresentedCredential {}

    /**
     * Vendor API key, {@code key_id.key_secret}.
     */
    record VendorKey(String raw, String keyId, String keySecret) implements PresentedCredential {}

    record Unrecognized(String raw) implements PresentedCredential {}

    /**
     * Classify a raw value by prefix and dot structure.
     */
    static PresentedCredential parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Unrecognized(raw);
        }
        if (raw.startsWith(TokenIssuer.ACCESS_TOKEN_PREFIX)) {
            return new OAuthAccess(raw);
        }
        if (raw.startsWith(TokenIssuer.REFRESH_TOKEN_PREFIX)) {
            return new OAuthRefresh(raw);
        }
        if (raw.startsWith(TokenIssuer.LEGACY_REFRESH_PREFIX)) {
            return new LegacyRefresh(raw);
        }

        int dots = countDots(raw);
        if (dots == 2) {
            return new LegacySession(raw);
        }
        if (dots == 1) {
            int dot = raw.indexOf('.');
            String keyId = raw.substring(0, dot);
            String secret = raw.substring(dot + 1);
            if (!keyId.isEmpty() && !secret.isEmpty()) {
                return new VendorKey(raw, keyId, secret);
            }
        }
        return new Unrecognized(raw);
    }

    /**
     * Extract the value of a {@code Bearer} Authorization header, or null.
     */
    static String bearerValue(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String prefix = "Bearer ";
        if (authorizationHeader.length() <= prefix.length()
                || !authorizationHeader.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return null;
        }
        return authorizationHeader.substring(prefix.length()).trim();
    }

    private static int countDots(String raw) {
        int count = 0;
        for (int i = 0; i < raw.length(); i++) {
            if (raw.charAt(i) == '.') {
                count++;
            }
        }
        return count;
    }
}
