package tech.authgate.platform.authentication.idp.mapper;

import tech.authgate.platform.authentication.idp.UserAccount;
import tech.authgate.platform.authentication.idp.entity.UserAccountEntity;

/**
 * Mapper for converting between UserAccount domain and entity.
 */
public final class UserAccountMapper {

    private UserAccountMapper() {
    }

    public static UserAccount toDomain(UserAccountEntity entity) {
        if (entity == null) {
            return null;
        }

        UserAccount domain = new UserAccount();
        domain.id = entity.id;
        domain.email = entity.email;
        domain.passwordHash = entity.passwordHash;
        domain.role = entity.role;
        domain.active = entity.active;
        domain.createdAt = entity.createdAt;
        domain.lastLoginAt = entity.lastLoginAt;
        return domain;
    }

    public static UserAccountEntity toEntity(UserAccount domain) {
        if (domain == null) {
            return null;
        }

        UserAccountEntity entity = new UserAccountEntity();
        entity.id = domain.id;
        entity.email = domain.email;
        entity.passwordHash = domain.passwordHash;
        entity.role = domain.role;
        entity.active = domain.active;
        entity.createdAt = domain.createdAt;
        entity.lastLoginAt = domain.lastLoginAt;
        return entity;
    }
}
