package tech.authgate.platform.authentication.oauth.mapper;

import tech.authgate.platform.authentication.oauth.OAuthClient;
import tech.authgate.platform.authentication.oauth.entity.OAuthClientEntity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mapper for converting between OAuthClient domain and entity.
 */
public final class OAuthClientMapper {

    private OAuthClientMapper() {
    }

    public static OAuthClient toDomain(OAuthClientEntity entity) {
        if (entity == null) {
            return null;
        }

        OAuthClient domain = new OAuthClient();
        domain.id = entity.id;
        domain.clientId = entity.clientId;
        domain.clientName = entity.clientName;
        domain.clientType = entity.clientType;
        domain.clientSecretHash = entity.clientSecretHash;
        domain.redirectUris = entity.redirectUris != null ? new ArrayList<>(entity.redirectUris) : new ArrayList<>();
        domain.allowedScopes = entity.allowedScopes != null ? new ArrayList<>(entity.allowedScopes) : new ArrayList<>();
        domain.defaultScopes = splitScopes(entity.defaultScopes);
        domain.requiresPkce = entity.requiresPkce;
        domain.enabled = entity.enabled;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OAuthClientEntity toEntity(OAuthClient domain) {
        if (domain == null) {
            return null;
        }

        OAuthClientEntity entity = new OAuthClientEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Update existing entity with values from domain object.
     */
    public static void updateEntity(OAuthClientEntity entity, OAuthClient domain) {
        entity.clientId = domain.clientId;
        entity.clientName = domain.clientName;
        entity.clientType = domain.clientType;
        entity.clientSecretHash = domain.clientSecretHash;
        entity.redirectUris = domain.redirectUris != null ? new ArrayList<>(domain.redirectUris) : new ArrayList<>();
        entity.allowedScopes = domain.allowedScopes != null ? new ArrayList<>(domain.allowedScopes) : new ArrayList<>();
        entity.defaultScopes = domain.defaultScopes != null ? String.join(" ", domain.defaultScopes) : null;
        entity.requiresPkce = domain.requiresPkce;
        entity.enabled = domain.enabled;
        entity.updatedAt = domain.updatedAt;
    }

    private static List<String> splitScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(scopes.trim().split("\\s+")));
    }
}
