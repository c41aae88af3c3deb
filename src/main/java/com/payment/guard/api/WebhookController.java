package com.payment.guard.api;

import com.payment.guard.core.GuardDecision;
import com.payment.guard.core.PaymentGuard;
import com.payment.guard.domain.WebhookEnvelope;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound provider webhooks. The body is taken verbatim so the signature is checked over the exact
 * bytes the provider signed.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Authenticated payment-provider callbacks")
public class WebhookController {

    private final PaymentGuard paymentGuard;

    @PostMapping("/{sourceTag}")
    @Operation(summary = "Receive provider webhook",
            description = "Signature: X-Signature or X-Yellowcard-Signature (hex HMAC-SHA256 of timestamp.body, optional sha256= prefix). "
                    + "Timestamp: X-Timestamp or X-Yellowcard-Timestamp (Unix seconds, within 300s).")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accepted."),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature, or stale timestamp."),
            @ApiResponse(responseCode = "429", description = "Too many deliveries from this address."),
            @ApiResponse(responseCode = "500", description = "Internal verification error; the delivery was not accepted.")
    })
    public ResponseEntity<Map<String, Object>> receive(
            @PathVariable String sourceTag,
            @RequestBody(required = false) String body,
            @RequestHeader(value = "X-Signature", required = false) String signature,
            @RequestHeader(value = "X-Yellowcard-Signature", required = false) String yellowcardSignature,
            @RequestHeader(value = "X-Timestamp", required = false) String timestamp,
            @RequestHeader(value = "X-Yellowcard-Timestamp", required = false) String yellowcardTimestamp,
            HttpServletRequest httpRequest) {
        WebhookEnvelope envelope = WebhookEnvelope.builder()
                .rawBody(body != null ? body : "")
                .signatureHeader(signature != null ? signature : yellowcardSignature)
                .timestampHeader(timestamp != null ? timestamp : yellowcardTimestamp)
                .sourceTag(sourceTag)
                .sourceIp(httpRequest.getRemoteAddr())
                .userAgent(httpRequest.getHeader(HttpHeaders.USER_AGENT))
                .build();

        GuardDecision decision = paymentGuard.checkWebhook(envelope);

        Map<String, Object> responseBody = new LinkedHashMap<>();
        if (decision.isApproved()) {
            responseBody.put("received", true);
            return ResponseEntity.ok(responseBody);
        }
        responseBody.put("error", decision.getReasonCode().name());
        responseBody.put("reason", decision.getReason());
        responseBody.put("message", decision.getReasonCode().getMessage());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(decision.getHttpStatus());
        if (decision.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
        }
        return response.body(responseBody);
    }
}
