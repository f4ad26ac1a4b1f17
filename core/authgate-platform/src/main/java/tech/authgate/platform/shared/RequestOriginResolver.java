package tech.authgate.platform.shared;

import io.quarkus.vertx.http.runtime.CurrentVertxRequest;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.RoutingContext;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.authgate.platform.audit.RequestOrigin;

/**
 * Resolves the network origin of the current HTTP request for audit events.
 *
 * The first X-Forwarded-For entry wins when present, since the gateway runs behind a
 * TLS-terminating proxy.
 */
@ApplicationScoped
public class RequestOriginResolver {

    @Inject
    CurrentVertxRequest currentRequest;

    public RequestOrigin current() {
        RoutingContext context = currentRequest.getCurrent();
        if (context == null) {
            return RequestOrigin.UNKNOWN;
        }
        HttpServerRequest request = context.request();
        return new RequestOrigin(clientIp(request), request.getHeader("User-Agent"));
    }

    private static String clientIp(HttpServerRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
        }
        SocketAddress remote = request.remoteAddress();
        return remote != null ? remote.host() : null;
    }
}
