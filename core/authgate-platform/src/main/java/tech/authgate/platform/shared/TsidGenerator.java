package tech.authgate.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * TSID (time-sorted id) generation for all persisted records.
 *
 * IDs carry a 3-character prefix naming the record type:
 * "{prefix}_{tsid}", e.g. "tok_0HZXEQ5Y8JY5Z".
 */
public class TsidGenerator {

    public static final String SEPARATOR = "_";

    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Raw TSID without prefix, for non-entity ids such as request ids.
     */
    public static String generateRaw() {
        return TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
