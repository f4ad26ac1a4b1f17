package tech.authgate.platform.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * PKCE (Proof Key for Code Exchange), S256 only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client sends code_challenge = BASE64URL(SHA256(code_verifier)) to /authorize
 * 3. Server stores code_challenge with the authorization code
 * 4. Client sends code_verifier to /token
 * 5. Server recomputes the challenge and compares in constant time
 *
 * The {@code plain} method is rejected.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    /**
     * code_challenge = BASE64URL(SHA256(code_verifier))
     */
    public String computeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify a code verifier against a stored S256 challenge.
     *
     * @return true only if method is S256 and the recomputed challenge matches
     */
    public boolean verify(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeVerifier.isEmpty() || codeChallenge == null) {
            return false;
        }
        if (!isSupportedMethod(method)) {
            return false;
        }
        byte[] computed = computeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(computed, codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * An S256 challenge is always 43 base64url characters.
     */
    public boolean isValidChallenge(String codeChallenge) {
        return codeChallenge != null && codeChallenge.matches("^[A-Za-z0-9_-]{43}$");
    }
}
