package org.crmjobs.rest.auth;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.crmjobs.utils.ResponseUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Lets a request through only when its X-Admin-Token header matches the configured token.
 * Without a configured token every request is refused.
 */
public class AdminTokenMiddleware implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminTokenMiddleware.class);

    public static final HttpString ADMIN_TOKEN_HEADER = new HttpString("X-Admin-Token");

    private final HttpHandler next;
    private final byte[] expected;

    public AdminTokenMiddleware(HttpHandler next, String adminToken) {
        this.next = next;
        this.expected = adminToken != null && !adminToken.isBlank()
                ? adminToken.getBytes(StandardCharsets.UTF_8)
                : null;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (expected == null) {
            ResponseUtil.sendError(exchange, StatusCodes.FORBIDDEN, "Admin operations are disabled: no admin token configured.");
            return;
        }

        String provided = exchange.getRequestHeaders().getFirst(ADMIN_TOKEN_HEADER);
        if (provided == null || !MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected admin request to {} from {}", exchange.getRequestPath(),
                    exchange.getSourceAddress() != null ? exchange.getSourceAddress().getHostString() : "unknown");
            ResponseUtil.sendError(exchange, StatusCodes.UNAUTHORIZED, "Missing or invalid admin token.");
            return;
        }

        next.handleRequest(exchange);
    }
}
