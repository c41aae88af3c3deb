package com.payment.guard.api;

import com.payment.guard.core.GuardDecision;
import com.payment.guard.core.GuardState;
import com.payment.guard.core.PaymentGuard;
import com.payment.guard.core.ReasonCode;
import com.payment.guard.domain.WebhookEnvelope;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    private static final String BODY = "{\"event\":\"payment.completed\",  \"id\":\"tx-1\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentGuard paymentGuard;

    @Test
    void acceptedDeliveryReturnsReceived() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.APPROVED)
                .reason("approved")
                .build());

        mockMvc.perform(post("/api/v1/webhooks/yellowcard")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Yellowcard-Signature", "sha256=abcd")
                        .header("X-Yellowcard-Timestamp", "1772366400")
                        .with(request -> {
                            request.setRemoteAddr("52.1.1.1");
                            return request;
                        })
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        ArgumentCaptor<WebhookEnvelope> captor = ArgumentCaptor.forClass(WebhookEnvelope.class);
        verify(paymentGuard).checkWebhook(captor.capture());
        WebhookEnvelope envelope = captor.getValue();
        assertThat(envelope.getRawBody()).isEqualTo(BODY);
        assertThat(envelope.getSignatureHeader()).isEqualTo("sha256=abcd");
        assertThat(envelope.getTimestampHeader()).isEqualTo("1772366400");
        assertThat(envelope.getSourceTag()).isEqualTo("yellowcard");
        assertThat(envelope.getSourceIp()).isEqualTo("52.1.1.1");
    }

    @Test
    void spoofedForwardingHeadersDoNotChangeTheSourceAddress() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.APPROVED)
                .reason("approved")
                .build());

        for (String forwarded : new String[]{"9.9.9.1", "9.9.9.2", "9.9.9.3"}) {
            mockMvc.perform(post("/api/v1/webhooks/yellowcard")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("X-Forwarded-For", forwarded)
                            .header("X-Real-IP", forwarded)
                            .content(BODY))
                    .andExpect(status().isOk());
        }

        ArgumentCaptor<WebhookEnvelope> captor = ArgumentCaptor.forClass(WebhookEnvelope.class);
        verify(paymentGuard, times(3)).checkWebhook(captor.capture());
        assertThat(captor.getAllValues()).extracting(WebhookEnvelope::getSourceIp)
                .containsOnly("127.0.0.1");
    }

    @Test
    void genericHeadersTakePrecedence() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.APPROVED)
                .reason("approved")
                .build());

        mockMvc.perform(post("/api/v1/webhooks/internal")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Signature", "ff00")
                        .header("X-Yellowcard-Signature", "00ff")
                        .header("X-Timestamp", "1")
                        .content(BODY))
                .andExpect(status().isOk());

        ArgumentCaptor<WebhookEnvelope> captor = ArgumentCaptor.forClass(WebhookEnvelope.class);
        verify(paymentGuard).checkWebhook(captor.capture());
        assertThat(captor.getValue().getSignatureHeader()).isEqualTo("ff00");
        assertThat(captor.getValue().getTimestampHeader()).isEqualTo("1");
    }

    @Test
    void refusedDeliveryIsUnauthorized() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.REJECTED)
                .reasonCode(ReasonCode.WEBHOOK_AUTH_FAILED)
                .reason("webhook_replay")
                .build());

        mockMvc.perform(post("/api/v1/webhooks/yellowcard").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("WEBHOOK_AUTH_FAILED"))
                .andExpect(jsonPath("$.reason").value("webhook_replay"))
                .andExpect(jsonPath("$.received").doesNotExist());
    }

    @Test
    void throttledDeliveryCarriesRetryAfter() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.REJECTED)
                .reasonCode(ReasonCode.WEBHOOK_RATE_LIMIT)
                .reason("rate_limited")
                .retryAfterSeconds(30L)
                .build());

        mockMvc.perform(post("/api/v1/webhooks/yellowcard").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "30"));
    }

    @Test
    void internalVerificationErrorIsServerError() throws Exception {
        when(paymentGuard.checkWebhook(any())).thenReturn(GuardDecision.builder()
                .state(GuardState.REJECTED)
                .reasonCode(ReasonCode.VERIFICATION_ERROR)
                .reason("verification_error")
                .build());

        mockMvc.perform(post("/api/v1/webhooks/yellowcard").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("VERIFICATION_ERROR"));
    }
}
