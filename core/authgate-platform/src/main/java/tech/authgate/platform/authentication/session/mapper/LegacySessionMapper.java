package tech.authgate.platform.authentication.session.mapper;

import tech.authgate.platform.authentication.session.LegacySession;
import tech.authgate.platform.authentication.session.entity.LegacySessionEntity;

/**
 * Mapper for converting between LegacySession domain and entity.
 */
public final class LegacySessionMapper {

    private static final int USER_AGENT_MAX = 500;

    private LegacySessionMapper() {
    }

    public static LegacySession toDomain(LegacySessionEntity entity) {
        if (entity == null) {
            return null;
        }

        LegacySession domain = new LegacySession();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.tokenHash = entity.tokenHash;
        domain.refreshTokenHash = entity.refreshTokenHash;
        domain.platform = entity.platform;
        domain.ipAddress = entity.ipAddress;
        domain.userAgent = entity.userAgent;
        domain.createdAt = entity.createdAt;
        domain.lastUsedAt = entity.lastUsedAt;
        domain.expiresAt = entity.expiresAt;
        domain.absoluteExpiresAt = entity.absoluteExpiresAt;
        domain.revokedAt = entity.revokedAt;
        return domain;
    }

    public static LegacySessionEntity toEntity(LegacySession domain) {
        if (domain == null) {
            return null;
        }

        LegacySessionEntity entity = new LegacySessionEntity();
        entity.id = domain.id;
        entity.userId = domain.userId;
        entity.tokenHash = domain.tokenHash;
        entity.refreshTokenHash = domain.refreshTokenHash;
        entity.platform = domain.platform;
        entity.ipAddress = domain.ipAddress;
        entity.userAgent = domain.userAgent != null && domain.userAgent.length() > USER_AGENT_MAX
            ? domain.userAgent.substring(0, USER_AGENT_MAX)
            : domain.userAgent;
        entity.createdAt = domain.createdAt;
        entity.lastUsedAt = domain.lastUsedAt;
        entity.expiresAt = domain.expiresAt;
        entity.absoluteExpiresAt = domain.absoluteExpiresAt;
        entity.revokedAt = domain.revokedAt;
        return entity;
    }
}
