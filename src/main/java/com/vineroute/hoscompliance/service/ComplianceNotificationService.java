package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.model.ComplianceViolation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes compliance findings over STOMP, to the dashboard topic
 * (/topic/compliance-alerts) and to the driver's own topic, and logs them
 * for the operations team.
 *
 * Push is best effort: a dashboard without subscribers, or a broker hiccup,
 * must never fail a clock-out. Inside a transaction the push waits for the
 * commit, so a rolled-back clock-out never reaches the dashboard.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceNotificationService {

    public static final String ALERT_TOPIC = "/topic/compliance-alerts";
    public static final String DRIVER_ALERT_TOPIC = ALERT_TOPIC + "/driver/";

    private final SimpMessagingTemplate messagingTemplate;
    private final Clock clock;

    /**
     * Publishes once the surrounding transaction commits; drops the findings
     * on rollback. Without an active transaction, publishes right away.
     */
    public void publishAfterCommit(Long driverId, Long timeCardId, List<ComplianceViolation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publishViolations(driverId, timeCardId, violations);
            return;
        }
        List<ComplianceViolation> snapshot = List.copyOf(violations);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publishViolations(driverId, timeCardId, snapshot);
            }
        });
        log.debug("{} alert(s) for driver #{} queued until commit", snapshot.size(), driverId);
    }

    public void publishViolations(Long driverId, Long timeCardId, List<ComplianceViolation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        for (ComplianceViolation v : violations) {
            log.warn("[COMPLIANCE ALERT] driver #{} — {} ({}): {}",
                    driverId, v.getType(), v.getSeverity(), v.getMessage());
        }

        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("driverId", driverId);
        msg.put("timeCardId", timeCardId);
        msg.put("violations", violations.stream().map(v -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", v.getType().name());
            m.put("severity", v.getSeverity().name());
            m.put("message", v.getMessage());
            m.put("regulation", v.getRegulation());
            return m;
        }).toList());
        msg.put("timestamp", Instant.now(clock).toString());

        try {
            messagingTemplate.convertAndSend(ALERT_TOPIC, msg);
            messagingTemplate.convertAndSend(DRIVER_ALERT_TOPIC + driverId, msg);
            log.debug("WS pushed {} alert(s) for driver #{} to {}", violations.size(), driverId, ALERT_TOPIC);
        } catch (MessagingException e) {
            log.error("WS push of compliance alerts failed for driver #{} — {}", driverId, e.getMessage());
        }
    }
}
