package tech.authgate.platform.authentication;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.build.Jwt;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Signs and verifies legacy session tokens (RS256).
 *
 * Supports two modes:
 * 1. File-based keys (production) - loads PEM keys from configured paths
 * 2. Generated keys (development) - generates an RSA key pair once and persists it under dev-key-dir
 *
 * A valid signature is only ever a pre-filter. Callers must still find the session record by hash.
 */
@ApplicationScoped
public class JwtKeyService {

    private static final Logger LOG = Logger.getLogger(JwtKeyService.class);
    private static final int KEY_SIZE = 2048;

    /** Value of the {@code typ} claim on legacy session tokens. */
    public static final String LEGACY_TOKEN_TYPE = "legacy";

    @Inject
    AuthConfig config;

    private RSAPrivateKey privateKey;
    private RSAPublicKey publicKey;
    private String keyId;

    @PostConstruct
    void init() {
        try {
            var jwt = config.jwt();
            if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
                loadKeysFromFiles(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
            } else {
                loadOrGenerateDevKeys(Path.of(jwt.devKeyDir()));
            }
            this.keyId = generateKeyId(publicKey);
            LOG.infof("JWT key service initialized with key ID: %s", keyId);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize JWT keys", e);
        }
    }

    /**
     * Load dev keys from a local directory, or generate and persist new ones so that
     * sessions survive restarts during development.
     */
    private void loadOrGenerateDevKeys(Path keyDir) throws Exception {
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev JWT keys from %s", keyDir);
            this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(
                new PKCS8EncodedKeySpec(Files.readAllBytes(privateKeyFile)));
            this.publicKey = (RSAPublicKey) keyFactory.generatePublic(
                new X509EncodedKeySpec(Files.readAllBytes(publicKeyFile)));
        } else {
            LOG.infof("Generating new dev JWT keys (will be persisted to %s)", keyDir);
            generateKeyPair();
            persistDevKeys(keyDir, privateKeyFile, publicKeyFile);
        }
        LOG.warn("Using dev JWT keys. Configure authgate.auth.jwt.private-key-path and authgate.auth.jwt.public-key-path for production.");
    }

    private void persistDevKeys(Path keyDir, Path privateKeyFile, Path publicKeyFile) throws IOException {
        Files.createDirectories(keyDir);
        Files.write(privateKeyFile, privateKey.getEncoded());
        Files.write(publicKeyFile, publicKey.getEncoded());
    }

    private void loadKeysFromFiles(Path privateKeyFile, Path publicKeyFile) throws Exception {
        LOG.info("Loading JWT keys from files");
        byte[] privateKeyBytes = parsePemKey(Files.readString(privateKeyFile, StandardCharsets.US_ASCII), "PRIVATE KEY");
        byte[] publicKeyBytes = parsePemKey(Files.readString(publicKeyFile, StandardCharsets.US_ASCII), "PUBLIC KEY");

        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        this.privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        this.publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
    }

    private byte[] parsePemKey(String pem, String type) {
        String base64 = pem
                .replace("-----BEGIN " + type + "-----", "")
                .replace("-----END " + type + "-----", "")
                .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }

    private void generateKeyPair() throws NoSuchAlgorithmException {
        KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(KEY_SIZE, new SecureRandom());
        KeyPair keyPair = keyGen.generateKeyPair();
        this.privateKey = (RSAPrivateKey) keyPair.getPrivate();
        this.publicKey = (RSAPublicKey) keyPair.getPublic();
    }

    private String generateKeyId(RSAPublicKey key) throws NoSuchAlgorithmException {
        byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
        return Base64.getUrlEncoder().withoutPadding().encodeToString(hash).substring(0, 8);
    }

    /**
     * Sign a legacy session token.
     *
     * @param sessionId  session record id (sid claim)
     * @param userId     user id (sub claim)
     * @param platform   client platform the session was opened from
     * @param issuedAt   iat
     * @param expiresAt  absolute cap on the session (exp)
     */
    public String issueLegacySessionToken(String sessionId, String userId, String platform,
                                          Instant issuedAt, Instant expiresAt) {
        return Jwt.issuer(config.jwt().issuer())
                .subject(userId)
                .claim("sid", sessionId)
                .claim("platform", platform)
                .claim("typ", LEGACY_TOKEN_TYPE)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .jws()
                .keyId(keyId)
                .sign(privateKey);
    }

    /**
     * Verify signature, issuer, expiry and token type.
     *
     * @return the verified claims, or empty if any check fails
     */
    public Optional<LegacyTokenClaims> verifyLegacySessionToken(String token) {
        try {
            JWTParser parser = new DefaultJWTParser();
            JsonWebToken jwt = parser.verify(token, publicKey);

            if (!config.jwt().issuer().equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", config.jwt().issuer(), jwt.getIssuer());
                return Optional.empty();
            }
            if (jwt.getExpirationTime() < Instant.now().getEpochSecond()) {
                LOG.debug("Token expired");
                return Optional.empty();
            }
            Object typ = jwt.getClaim("typ");
            Object sid = jwt.getClaim("sid");
            if (typ == null || !LEGACY_TOKEN_TYPE.equals(typ.toString()) || sid == null) {
                LOG.debug("Token is not a legacy session token");
                return Optional.empty();
            }
            Object platform = jwt.getClaim("platform");
            return Optional.of(new LegacyTokenClaims(
                jwt.getSubject(),
                sid.toString(),
                platform != null ? platform.toString() : null,
                Instant.ofEpochSecond(jwt.getExpirationTime())));
        } catch (Exception e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }

    public String getIssuer() {
        return config.jwt().issuer();
    }

    public String getKeyId() {
        return keyId;
    }

    /**
     * Claims carried by a verified legacy session token.
     */
    public record LegacyTokenClaims(String userId, String sessionId, String platform, Instant expiresAt) {}
}
