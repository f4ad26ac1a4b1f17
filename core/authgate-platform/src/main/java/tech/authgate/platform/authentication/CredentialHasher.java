package tech.authgate.platform.authentication;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Hashes secrets at two deliberately different strengths.
 *
 * <ul>
 *   <li>{@link #fastHash} is SHA-256 hex. Used for high-entropy values we generate ourselves
 *       (authorization codes, OAuth tokens, legacy session tokens) which must be looked up by hash.</li>
 *   <li>{@link #slowHash} is Argon2id in PHC format with tunable cost. Used for vendor key secrets,
 *       client secrets and passwords.</li>
 * </ul>
 *
 * The two are not interchangeable: {@link #verifySlow} only accepts Argon2id PHC strings, so a
 * SHA-256 digest stored by mistake can never verify.
 */
@ApplicationScoped
public class CredentialHasher {

    private static final String ARGON2ID_PREFIX = "$argon2id$";
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private final Argon2 argon2;
    private final int memoryKib;
    private final int iterations;
    private final int parallelism;

    @Inject
    public CredentialHasher(AuthConfig config) {
        this(config.hashing().memoryKib(), config.hashing().iterations(), config.hashing().parallelism());
    }

    public CredentialHasher(int memoryKib, int iterations, int parallelism) {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
        this.memoryKib = memoryKib;
        this.iterations = iterations;
        this.parallelism = parallelism;
    }

    /**
     * SHA-256 of the UTF-8 bytes, lower-case hex.
     */
    public String fastHash(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value to hash cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Argon2id hash in PHC format, e.g. {@code $argon2id$v=19$m=65536,t=3,p=4$...}.
     */
    public String slowHash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        return argon2.hash(iterations, memoryKib, parallelism, secret.toCharArray());
    }

    /**
     * Verify a secret against an Argon2id hash. Returns false for anything that is not one.
     */
    public boolean verifySlow(String secret, String hash) {
        if (secret == null || hash == null || !hash.startsWith(ARGON2ID_PREFIX)) {
            return false;
        }
        try {
            return argon2.verify(hash, secret.toCharArray());
        } catch (RuntimeException e) {
            // Malformed PHC string
            return false;
        }
    }

    /**
     * Whether a stored slow hash was produced with weaker parameters than the current ones.
     */
    public boolean needsRehash(String hash) {
        if (hash == null || !hash.startsWith(ARGON2ID_PREFIX)) {
            return true;
        }
        String[] parts = hash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        Map<String, Integer> params = parseParameters(parts[3]);
        return !Integer.valueOf(memoryKib).equals(params.get("m"))
            || !Integer.valueOf(iterations).equals(params.get("t"))
            || !Integer.valueOf(parallelism).equals(params.get("p"));
    }

    /**
     * Parses a PHC parameter segment such as {@code m=65536,t=3,p=4}. Malformed entries are skipped.
     */
    private static Map<String, Integer> parseParameters(String segment) {
        Map<String, Integer> params = new HashMap<>();
        for (String entry : segment.split(",")) {
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            try {
                params.put(entry.substring(0, eq), Integer.parseInt(entry.substring(eq + 1)));
            } catch (NumberFormatException e) {
                // Left out of the map, so the hash is treated as stale
                params.remove(entry.substring(0, eq));
            }
        }
        return params;
    }

    /**
     * Constant-time comparison of two strings.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
