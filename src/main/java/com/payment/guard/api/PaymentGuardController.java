package com.payment.guard.api;

import com.payment.guard.core.GuardDecision;
import com.payment.guard.core.PaymentGuard;
import com.payment.guard.domain.PaymentAttempt;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for payment attempt checks and execution outcomes.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Security and fraud checks for mobile-money payments")
public class PaymentGuardController {

    private final PaymentGuard paymentGuard;

    @PostMapping("/check")
    @Operation(
            summary = "Check payment attempt",
            description = "Runs rate limiting, provider validation, daily limits and risk scoring. "
                    + "Approved attempts return the fee quote; the caller then executes the payment and reports the outcome.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "APPROVED. Body has fee, total and formattedPhone.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentCheckResponseDto.class))),
            @ApiResponse(responseCode = "202", description = "CHALLENGED with MANUAL_REVIEW_REQUIRED and estimatedReviewTime."),
            @ApiResponse(responseCode = "400", description = "VALIDATION_ERROR (errors per field) or DAILY_LIMIT_EXCEEDED."),
            @ApiResponse(responseCode = "403", description = "SECURITY_BLOCK. Body carries the risk score only."),
            @ApiResponse(responseCode = "429", description = "PAYMENT_RATE_LIMIT. Retry-After and X-RateLimit-* headers are set."),
            @ApiResponse(responseCode = "503", description = "RATE_LIMITER_UNAVAILABLE. Counter store down; the attempt is denied.")
    })
    public ResponseEntity<PaymentCheckResponseDto> check(@Valid @RequestBody PaymentCheckRequestDto dto,
                                                         HttpServletRequest httpRequest) {
        PaymentAttempt attempt = PaymentAttempt.builder()
                .attemptId(dto.getAttemptId())
                .userId(dto.getUserId())
                .amount(dto.getAmount())
                .currency(dto.getCurrency())
                .providerId(dto.getProviderId())
                .countryCode(dto.getCountryCode())
                .phoneNumber(dto.getPhoneNumber())
                .sourceIp(httpRequest.getRemoteAddr())
                .userAgent(httpRequest.getHeader(HttpHeaders.USER_AGENT))
                .accept(httpRequest.getHeader(HttpHeaders.ACCEPT))
                .acceptEncoding(httpRequest.getHeader(HttpHeaders.ACCEPT_ENCODING))
                .build();

        GuardDecision decision = paymentGuard.checkPayment(attempt);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(decision.getHttpStatus());
        if (decision.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.getRetryAfterSeconds()));
            response.header("X-RateLimit-Remaining", String.valueOf(decision.getRateLimitRemaining()));
            response.header("X-RateLimit-Reset", String.valueOf(decision.getRateLimitResetAt().getEpochSecond()));
        }
        return response.body(PaymentCheckResponseDto.from(decision));
    }

    @PostMapping("/attempts/{attemptId}/outcome")
    @Operation(summary = "Report execution outcome",
            description = "Marks a checked attempt COMPLETED or FAILED. Feeds failure counts and daily limits.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Outcome recorded."),
            @ApiResponse(responseCode = "400", description = "Status other than COMPLETED or FAILED."),
            @ApiResponse(responseCode = "404", description = "Unknown attempt id.")
    })
    public ResponseEntity<Void> outcome(@PathVariable String attemptId, @Valid @RequestBody OutcomeRequestDto dto) {
        boolean updated = paymentGuard.recordOutcome(attemptId, dto.getStatus());
        return updated ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
