package tech.authgate.platform.authentication.oauth.panache;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.mockito.InjectSpy;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.authgate.platform.authentication.oauth.OAuthToken;
import tech.authgate.platform.authentication.oauth.OAuthTokenRepository;
import tech.authgate.platform.shared.EntityType;
import tech.authgate.platform.shared.TsidGenerator;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

/**
 * Hash lookups retried after a datastore failure must not poison the caller's transaction.
 */
@Tag("integration")
@QuarkusTest
class PanacheOAuthTokenRepositoryTest {

    @InjectSpy
    PanacheOAuthTokenRepository panacheRepository;

    @Inject
    OAuthTokenRepository tokenRepository;

    private OAuthToken storedToken() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        OAuthToken token = new OAuthToken();
        token.tokenHash = UUID.randomUUID().toString().replace("-", "");
        token.tokenType = OAuthToken.TokenType.REFRESH;
        token.userId = TsidGenerator.generate(EntityType.USER_ACCOUNT);
        token.clientId = "retry-client";
        token.scope = "openid";
        token.chainId = TsidGenerator.generate(EntityType.AUTH_CODE);
        token.issuedAt = now;
        token.expiresAt = now.plus(Duration.ofDays(1));
        QuarkusTransaction.requiringNew().run(() -> tokenRepository.persist(token));
        return token;
    }

    @Test
    @DisplayName("findByTokenHash should recover from a failed attempt and leave the caller's transaction committable")
    void findByTokenHash_shouldKeepCallerTransactionUsable_whenFirstAttemptFails() {
        // Arrange
        OAuthToken token = storedToken();
        // First attempt fails inside Hibernate, which marks its transaction rollback-only
        doAnswer(invocation -> panacheRepository.getEntityManager()
                .createNativeQuery("select 1 from missing_table")
                .getResultList())
            .doCallRealMethod()
            .when(panacheRepository).find(eq("tokenHash"), any(Object[].class));

        // Act
        boolean revoked = QuarkusTransaction.requiringNew().call(() -> {
            Optional<OAuthToken> found = tokenRepository.findByTokenHash(token.tokenHash);
            assertThat(found).isPresent();
            return tokenRepository.revoke(found.get().id, "test_revocation", Instant.now());
        });

        // Assert
        assertThat(revoked).isTrue();
        verify(panacheRepository, atLeast(2)).find(eq("tokenHash"), any(Object[].class));
        assertThat(tokenRepository.findByTokenHash(token.tokenHash))
            .hasValueSatisfying(t -> assertThat(t.revokedReason).isEqualTo("test_revocation"));
    }
}
