package com.payment.guard.audit;

import com.payment.guard.core.GuardDecision;
import com.payment.guard.domain.PaymentAttempt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One [AUDIT] log line per terminal decision, for log-based retention alongside the event sink.
 * Phone numbers are masked; raw risk factors stay out of the log.
 */
@Slf4j
@Component
public class SecurityAuditLogger {

    public void logPaymentDecision(PaymentAttempt attempt, GuardDecision decision) {
        log.info("[AUDIT] PAYMENT_DECISION attemptId={} userId={} provider={} country={} amount={} currency={} phone={} state={} reasonCode={} riskScore={} trail={}",
                attempt.getAttemptId(),
                attempt.getUserId(),
                attempt.getProviderId(),
                attempt.getCountryCode(),
                attempt.getAmount(),
                attempt.getCurrency(),
                maskPhone(attempt.getPhoneNumber()),
                decision.getState(),
                decision.getReasonCode(),
                decision.getRiskScore(),
                decision.getTrail());
    }

    public void logWebhookDecision(String sourceTag, String sourceIp, GuardDecision decision) {
        log.info("[AUDIT] WEBHOOK_DECISION source={} ip={} state={} reasonCode={} reason={}",
                sourceTag, sourceIp, decision.getState(), decision.getReasonCode(), decision.getReason());
    }

    static String maskPhone(String phone) {
        if (phone == null || phone.length() <= 4) {
            return "****";
        }
        return "***" + phone.substring(phone.length() - 4);
    }
}
