package tech.authgate.platform.authentication.oauth.mapper;

import tech.authgate.platform.authentication.oauth.AuthorizationCode;
import tech.authgate.platform.authentication.oauth.entity.AuthorizationCodeEntity;

/**
 * Mapper for converting between AuthorizationCode domain and entity.
 */
public final class AuthorizationCodeMapper {

    private AuthorizationCodeMapper() {
    }

    public static AuthorizationCode toDomain(AuthorizationCodeEntity entity) {
        if (entity == null) {
            return null;
        }

        AuthorizationCode domain = new AuthorizationCode();
        domain.id = entity.id;
        domain.codeHash = entity.codeHash;
        domain.clientId = entity.clientId;
        domain.userId = entity.userId;
        domain.redirectUri = entity.redirectUri;
        domain.codeChallenge = entity.codeChallenge;
        domain.codeChallengeMethod = entity.codeChallengeMethod;
        domain.scope = entity.scope;
        domain.state = entity.state;
        domain.ipAddress = entity.ipAddress;
        domain.createdAt = entity.createdAt;
        domain.expiresAt = entity.expiresAt;
        domain.consumedAt = entity.consumedAt;
        return domain;
    }

    public static AuthorizationCodeEntity toEntity(AuthorizationCode domain) {
        if (domain == null) {
            return null;
        }

        AuthorizationCodeEntity entity = new AuthorizationCodeEntity();
        entity.id = domain.id;
        entity.codeHash = domain.codeHash;
        entity.clientId = domain.clientId;
        entity.userId = domain.userId;
        entity.redirectUri = domain.redirectUri;
        entity.codeChallenge = domain.codeChallenge;
        entity.codeChallengeMethod = domain.codeChallengeMethod;
        entity.scope = domain.scope;
        entity.state = domain.state;
        entity.ipAddress = domain.ipAddress;
        entity.createdAt = domain.createdAt;
        entity.expiresAt = domain.expiresAt;
        entity.consumedAt = domain.consumedAt;
        return entity;
    }
}
