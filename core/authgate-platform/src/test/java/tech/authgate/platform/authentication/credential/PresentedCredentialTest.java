package tech.authgate.platform.authentication.credential;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PresentedCredentialTest {

    @Test
    @DisplayName("parse should route each prefix to its own kind")
    void parse_shouldClassifyByPrefix() {
        assertThat(PresentedCredential.parse("agat_abc")).isInstanceOf(PresentedCredential.OAuthAccess.class);
        assertThat(PresentedCredential.parse("agrt_abc")).isInstanceOf(PresentedCredential.OAuthRefresh.class);
        assertThat(PresentedCredential.parse("agls_abc")).isInstanceOf(PresentedCredential.LegacyRefresh.class);
    }

    @Test
    @DisplayName("parse should treat three dot-separated segments as a legacy session token")
    void parse_shouldClassifyJwtShape_asLegacySession() {
        assertThat(PresentedCredential.parse("header.payload.signature"))
            .isInstanceOf(PresentedCredential.LegacySession.class);
    }

    @Test
    @DisplayName("parse should split a vendor key on its single dot")
    void parse_shouldSplitVendorKey_whenExactlyOneDot() {
        // Act
        PresentedCredential credential = PresentedCredential.parse("vk0hzabc.s3cr3t");

        // Assert
        assertThat(credential).isInstanceOf(PresentedCredential.VendorKey.class);
        PresentedCredential.VendorKey key = (PresentedCredential.VendorKey) credential;
        assertThat(key.keyId()).isEqualTo("vk0hzabc");
        assertThat(key.keySecret()).isEqualTo("s3cr3t");
    }

    @Test
    @DisplayName("parse should not recognize malformed values")
    void parse_shouldReturnUnrecognized_whenMalformed() {
        assertThat(PresentedCredential.parse(null)).isInstanceOf(PresentedCredential.Unrecognized.class);
        assertThat(PresentedCredential.parse("")).isInstanceOf(PresentedCredential.Unrecognized.class);
        assertThat(PresentedCredential.parse("nodots")).isInstanceOf(PresentedCredential.Unrecognized.class);
        assertThat(PresentedCredential.parse(".secret")).isInstanceOf(PresentedCredential.Unrecognized.class);
        assertThat(PresentedCredential.parse("key.")).isInstanceOf(PresentedCredential.Unrecognized.class);
        assertThat(PresentedCredential.parse("a.b.c.d")).isInstanceOf(PresentedCredential.Unrecognized.class);
    }

    @Test
    @DisplayName("bearerValue should extract the token case-insensitively")
    void bearerValue_shouldExtractToken() {
        assertThat(PresentedCredential.bearerValue("Bearer agat_abc")).isEqualTo("agat_abc");
        assertThat(PresentedCredential.bearerValue("bearer agat_abc")).isEqualTo("agat_abc");
        assertThat(PresentedCredential.bearerValue("Basic dXNlcjpwYXNz")).isNull();
        assertThat(PresentedCredential.bearerValue("Bearer ")).isNull();
        assertThat(PresentedCredential.bearerValue(null)).isNull();
    }
}
