package tech.authgate.platform.authentication.oauth.mapper;

import tech.authgate.platform.authentication.oauth.OAuthToken;
import tech.authgate.platform.authentication.oauth.entity.OAuthTokenEntity;

/**
 * Mapper for converting between OAuthToken domain and entity.
 */
public final class OAuthTokenMapper {

    private OAuthTokenMapper() {
    }

    public static OAuthToken toDomain(OAuthTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthToken domain = new OAuthToken();
        domain.id = entity.id;
        domain.tokenHash = entity.tokenHash;
        domain.tokenType = entity.tokenType;
        domain.userId = entity.userId;
        domain.clientId = entity.clientId;
        domain.scope = entity.scope;
        domain.parentTokenId = entity.parentTokenId;
        domain.chainId = entity.chainId;
        domain.issuedAt = entity.issuedAt;
        domain.expiresAt = entity.expiresAt;
        domain.revokedAt = entity.revokedAt;
        domain.revokedReason = entity.revokedReason;
        return domain;
    }

    public static OAuthTokenEntity toEntity(OAuthToken domain) {
        if (domain == null) {
            return null;
        }

        OAuthTokenEntity entity = new OAuthTokenEntity();
        entity.id = domain.id;
        entity.tokenHash = domain.tokenHash;
        entity.tokenType = domain.tokenType;
        entity.userId = domain.userId;
        entity.clientId = domain.clientId;
        entity.scope = domain.scope;
        entity.parentTokenId = domain.parentTokenId;
        entity.chainId = domain.chainId;
        entity.issuedAt = domain.issuedAt;
        entity.expiresAt = domain.expiresAt;
        entity.revokedAt = domain.revokedAt;
        entity.revokedReason = domain.revokedReason;
        return entity;
    }
}
