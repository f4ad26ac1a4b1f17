package tech.authgate.platform.admin;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Administrative API configuration.
 *
 * <pre>
 * authgate.admin.api-token=${ADMIN_API_TOKEN}
 * </pre>
 *
 * Without a token every admin route answers 401.
 */
@StaticInitSafe
@ConfigMapping(prefix = "authgate.admin")
public interface AdminConfig {

    @WithName("api-token")
    Optional<String> apiToken();
}
