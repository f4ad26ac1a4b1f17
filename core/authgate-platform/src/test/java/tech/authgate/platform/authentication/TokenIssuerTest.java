package tech.authgate.platform.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TokenIssuerTest {

    private final TokenIssuer issuer = new TokenIssuer();

    @Test
    @DisplayName("randomValue should carry 256 bits of entropy")
    void randomValue_shouldDecodeTo32Bytes() {
        // Act
        byte[] decoded = Base64.getUrlDecoder().decode(issuer.randomValue());

        // Assert
        assertThat(decoded).hasSize(32);
    }

    @Test
    @DisplayName("issued values should carry the prefix of their kind")
    void newValues_shouldCarryKindPrefix() {
        assertThat(issuer.newAuthorizationCode()).startsWith("agac_");
        assertThat(issuer.newAccessToken()).startsWith("agat_");
        assertThat(issuer.newRefreshToken()).startsWith("agrt_");
        assertThat(issuer.newLegacyRefreshToken()).startsWith("agls_");
    }

    @Test
    @DisplayName("randomValue should not repeat across many draws")
    void randomValue_shouldNotRepeat_whenDrawnManyTimes() {
        // Arrange
        Set<String> seen = new HashSet<>();

        // Act
        for (int i = 0; i < 10_000; i++) {
            seen.add(issuer.randomValue());
        }

        // Assert
        assertThat(seen).hasSize(10_000);
    }
}
