package io.deadswitch.transport.http;

import io.deadswitch.application.port.output.SecretDecryptor;
import io.deadswitch.application.service.CheckInTokenService;
import io.deadswitch.domain.model.CheckInResult;
import io.deadswitch.domain.model.Secret;
import io.deadswitch.domain.model.ShareAccessResult;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token-authenticated endpoints reached from reminder and disclosure links.
 *
 * - POST /api/check-in?token=... resets the deadline
 * - GET /api/secrets/{id}/server-share?token=... returns the decrypted server share
 */
public final class CheckInHandler {
    private static final Logger log = LoggerFactory.getLogger(CheckInHandler.class);

    private final CheckInTokenService tokenService;
    private final SecretDecryptor decryptor;

    public CheckInHandler(CheckInTokenService tokenService, SecretDecryptor decryptor) {
        this.tokenService = tokenService;
        this.decryptor = decryptor;
    }

    public void checkIn(HttpServerExchange exchange) {
        try {
            CheckInResult result = tokenService.consume(HttpResponses.param(exchange, "token"));
            if (!result.isSuccess()) {
                HttpResponses.sendError(exchange, result.error().httpStatus(), result.error().message());
                return;
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("secretTitle", result.secretTitle());
            body.put("nextCheckIn", result.nextCheckIn());
            body.put("message", "Your secret \"" + result.secretTitle() + "\" timer has been reset.");
            HttpResponses.sendJson(exchange, StatusCodes.OK, body);

        } catch (Exception e) {
            log.error("[CHECK-IN] Unexpected error: {}", e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }

    public void serverShare(HttpServerExchange exchange) {
        String secretId = HttpResponses.param(exchange, "id");
        try {
            ShareAccessResult access = tokenService.authorizeShareRead(secretId, HttpResponses.param(exchange, "token"));
            if (!access.isGranted()) {
                HttpResponses.sendError(exchange, access.error().httpStatus(), access.error().message());
                return;
            }

            Secret secret = access.secret();
            String share = decryptor.decrypt(secret.serverShare(), secret.iv(), secret.authTag());
            HttpResponses.sendJson(exchange, StatusCodes.OK, Map.of("serverShare", share));
            log.info("GET /api/secrets/{}/server-share → 200 OK", secretId);

        } catch (Exception e) {
            log.error("[SHARE READ] Failed to serve server share for {}: {}", secretId, e.getMessage(), e);
            HttpResponses.sendInternalError(exchange);
        }
    }
}
