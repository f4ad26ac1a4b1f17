package tech.authgate.platform.authentication.session;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of client a legacy session was opened from. Declared explicitly by the client,
 * never inferred from User-Agent.
 */
public enum ClientPlatform {
    CLI,
    WEB,
    API,
    MCP;

    public static Optional<ClientPlatform> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
