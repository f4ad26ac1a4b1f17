package tech.authgate.platform.shared;

/**
 * Record types and their 3-character ID prefixes.
 *
 * <pre>
 * String id = TsidGenerator.generate(EntityType.OAUTH_TOKEN);  // "tok_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    // OAuth
    OAUTH_CLIENT("oac"),
    AUTH_CODE("acd"),
    OAUTH_TOKEN("tok"),

    // Legacy sessions and identities
    LEGACY_SESSION("ses"),
    USER_ACCOUNT("usr"),

    // Vendors
    VENDOR_ORG("vnd"),
    VENDOR_KEY("vky"),
    VENDOR_USAGE("vus"),

    // Audit
    AUDIT_EVENT("aud");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
