package com.payment.guard.api;

import com.payment.guard.audit.SecurityEventSink;
import com.payment.guard.domain.ReviewTicket;
import com.payment.guard.domain.SecurityEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator reads over the security event log and the manual-review queue.
 */
@RestController
@RequestMapping("/api/v1/security")
@RequiredArgsConstructor
@Tag(name = "Security", description = "Security events and manual-review queue")
public class SecurityEventController {

    static final int MAX_LIMIT = 500;

    private final SecurityEventSink eventSink;

    @GetMapping("/events")
    @Operation(summary = "List recent security events", description = "Most recent first, at most 500")
    public ResponseEntity<List<SecurityEvent>> events(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(eventSink.recentEvents(clamp(limit)));
    }

    @GetMapping("/reviews")
    @Operation(summary = "List pending manual reviews", description = "Challenged attempts awaiting a human decision")
    public ResponseEntity<List<ReviewTicket>> reviews(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(eventSink.pendingReviews(clamp(limit)));
    }

    private static int clamp(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
