package tech.authgate.platform.authentication.idp;

import jakarta.persistence.PersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.authgate.platform.authentication.CredentialHasher;
import tech.authgate.platform.test.MutableClock;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InternalIdentityProviderTest {

    @Mock
    UserAccountRepository accounts;

    private final CredentialHasher hasher = spy(new CredentialHasher(1024, 1, 1));
    private InternalIdentityProvider provider;

    @BeforeEach
    void setUp() {
        provider = new InternalIdentityProvider();
        provider.accounts = accounts;
        provider.hasher = hasher;
        provider.clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
    }

    private UserAccount account(String password, boolean active, CredentialHasher hashedWith) {
        UserAccount account = new UserAccount();
        account.id = "usr_1";
        account.email = "jane@test.com";
        account.role = "user";
        account.active = active;
        account.passwordHash = hashedWith.slowHash(password);
        return account;
    }

    // ========================================
    // AUTHENTICATE TESTS
    // ========================================

    @Test
    @DisplayName("authenticate should return the user when the password matches")
    void authenticate_shouldReturnUser_whenPasswordMatches() {
        // Arrange
        when(accounts.findByEmail("jane@test.com")).thenReturn(Optional.of(account("CorrectHorse42!", true, hasher)));

        // Act
        Optional<AuthenticatedUser> user = provider.authenticate("jane@test.com", "CorrectHorse42!");

        // Assert
        assertThat(user).contains(new AuthenticatedUser("usr_1", "jane@test.com", "user"));
        verify(accounts).updateLastLogin(eq("usr_1"), any());
        verify(accounts, never()).updatePasswordHash(anyString(), anyString());
    }

    @Test
    @DisplayName("authenticate should reject a wrong password without touching the account")
    void authenticate_shouldReturnEmpty_whenPasswordWrong() {
        when(accounts.findByEmail("jane@test.com")).thenReturn(Optional.of(account("CorrectHorse42!", true, hasher)));

        assertThat(provider.authenticate("jane@test.com", "wrong")).isEmpty();
        verify(accounts, never()).updateLastLogin(anyString(), any());
    }

    @Test
    @DisplayName("authenticate should reject an inactive account even with the right password")
    void authenticate_shouldReturnEmpty_whenAccountInactive() {
        when(accounts.findByEmail("jane@test.com")).thenReturn(Optional.of(account("CorrectHorse42!", false, hasher)));

        assertThat(provider.authenticate("jane@test.com", "CorrectHorse42!")).isEmpty();
    }

    @Test
    @DisplayName("authenticate should still run a slow verification for an unknown identifier")
    void authenticate_shouldVerifyDummyHash_whenAccountUnknown() {
        when(accounts.findByEmail("ghost@test.com")).thenReturn(Optional.empty());

        assertThat(provider.authenticate("ghost@test.com", "anything")).isEmpty();
        verify(hasher).verifySlow(eq("anything"), anyString());
    }

    @Test
    @DisplayName("authenticate should upgrade a hash made under weaker parameters")
    void authenticate_shouldRehash_whenParametersOutdated() {
        // Arrange
        CredentialHasher weaker = new CredentialHasher(512, 1, 1);
        when(accounts.findByEmail("jane@test.com")).thenReturn(Optional.of(account("CorrectHorse42!", true, weaker)));

        // Act
        provider.authenticate("jane@test.com", "CorrectHorse42!");

        // Assert
        verify(accounts).updatePasswordHash(eq("usr_1"), startsWith("$argon2id$"));
    }

    @Test
    @DisplayName("authenticate should report the store as unavailable when the lookup fails")
    void authenticate_shouldThrowUnavailable_whenStoreFails() {
        when(accounts.findByEmail(anyString())).thenThrow(new PersistenceException("connection refused"));

        assertThatThrownBy(() -> provider.authenticate("jane@test.com", "x"))
            .isInstanceOf(IdentityProviderUnavailableException.class);
    }

    @Test
    @DisplayName("authenticate should reject blank input without a lookup")
    void authenticate_shouldReturnEmpty_whenInputBlank() {
        assertThat(provider.authenticate(" ", "x")).isEmpty();
        assertThat(provider.authenticate("jane@test.com", "")).isEmpty();
        verifyNoInteractions(accounts);
    }
}
