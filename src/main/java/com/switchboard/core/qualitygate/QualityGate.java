package com.switchboard.core.qualitygate;

import com.switchboard.core.config.SwitchboardProperties;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.ReviewResult;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Review, retry and escalate loop applied to delegated work.
 * <p>
 * The downstream unit is called at most {@code MAX_RETRIES + 1} times. FAILED and BLOCKED results
 * are returned as-is without review. When every attempt is rejected the gate returns BLOCKED with
 * reason {@value #ESCALATION_REASON} and writes a durable escalation for the root authority.
 */
@Service
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final int MAX_RETRIES = 2;
    public static final String ESCALATION_REASON = "QUALITY_GATE_ESCALATION";

    private final SharedStore store;
    private final SwitchboardProperties properties;
    private final SwitchboardMetrics metrics;

    public QualityGate(SharedStore store, SwitchboardProperties properties, SwitchboardMetrics metrics) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @param supervisorId supervisor running the gate
     * @param unitId       unit the work is delegated to
     * @param message      original message, attempt 0
     * @param delegate     performs one delegation attempt
     * @param reviewer     judges a successful attempt
     */
    public Report delegateWithReview(String supervisorId, String unitId, UnitMessage message,
                                     Function<UnitMessage, Report> delegate,
                                     Function<Report, ReviewResult> reviewer) {
        UnitMessage attemptMessage = message;
        List<String> lastFeedback = List.of();

        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            if (attempt > 0) {
                attemptMessage = retryMessage(message, lastFeedback, attempt);
            }
            Report report = delegate.apply(attemptMessage);
            if (report.isUnsuccessful()) {
                return report;
            }

            ReviewResult review = reviewer.apply(report);
            metrics.recordReviewResult(review.approved());
            if (review.approved()) {
                if (attempt > 0) {
                    log.info("Unit {} passed review on retry {}", unitId, attempt);
                }
                return report;
            }
            lastFeedback = review.feedback();
            log.info("Unit {} output rejected ({}) on attempt {}: {}",
                    unitId, review.severity(), attempt, lastFeedback);
        }

        return escalate(supervisorId, unitId, message, lastFeedback);
    }

    static UnitMessage retryMessage(UnitMessage original, List<String> feedback, int attempt) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("_reviewFeedback", feedback);
        extra.put("_retryAttempt", attempt);
        return original.withPayload(original.id() + "_retry_" + attempt, original.payloadWith(extra));
    }

    private Report escalate(String supervisorId, String unitId, UnitMessage message, List<String> feedback) {
        String rootAuthority = properties.getRootAuthority();
        String key = "escalation_" + message.id();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("unitId", unitId);
        body.put("originalTask", message.payload());
        body.put("reviewFeedback", feedback);
        body.put("retryCount", MAX_RETRIES);

        Map<String, Object> value = new LinkedHashMap<>();
        value.put("fromAgent", supervisorId);
        value.put("toAgent", rootAuthority);
        value.put("messageType", "NOTIFICATION");
        value.put("subject", "Quality gate exhausted for " + unitId);
        value.put("body", body);
        value.put("requiresResponse", true);
        value.put("responded", false);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", ESCALATION_REASON);
        data.put("unitId", unitId);
        data.put("retryCount", MAX_RETRIES);
        data.put("reviewFeedback", feedback);
        data.put("escalatedTo", rootAuthority);

        List<String> errors = new ArrayList<>();
        errors.add("Unit " + unitId + " failed review after " + MAX_RETRIES + " retries; escalated to " + rootAuthority);
        errors.addAll(feedback);

        try {
            store.write(StoreCategory.CROSS_AGENT, key, value, supervisorId,
                    WriteOptions.of(StorePriority.HIGH, "escalation", "quality-gate"));
            data.put("escalationKey", key);
            log.warn("Escalated {} from {} to {} after {} retries", unitId, supervisorId, rootAuthority, MAX_RETRIES);
        } catch (RuntimeException e) {
            log.error("Could not persist escalation {} for {}: {}", key, unitId, e.getMessage(), e);
            errors.add("Escalation record " + key + " was not persisted: " + e.getMessage());
        }
        metrics.incrementEscalations(supervisorId);
        return Report.blocked(message.id(), supervisorId, data, errors);
    }
}
