package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of handling one {@link UnitMessage} or {@link Signal}.
 *
 * @param taskId    id of the message or signal this report answers
 * @param unitId    unit that produced the report
 * @param status    outcome, never null
 * @param data      structured result data
 * @param errors    ordered human-readable reasons for FAILED or BLOCKED outcomes
 * @param timestamp when the report was produced
 */
public record Report(
    String taskId,
    String unitId,
    ReportStatus status,
    Map<String, Object> data,
    List<String> errors,
    Instant timestamp
) implements Serializable {

    public Report {
        Objects.requireNonNull(status, "Report status must never be omitted");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static Report completed(String taskId, String unitId, Map<String, Object> data) {
        return new Report(taskId, unitId, ReportStatus.COMPLETED, data, List.of(), Instant.now());
    }

    public static Report failed(String taskId, String unitId, String error) {
        return new Report(taskId, unitId, ReportStatus.FAILED, Map.of(), List.of(error), Instant.now());
    }

    public static Report failed(String taskId, String unitId, Map<String, Object> data, List<String> errors) {
        return new Report(taskId, unitId, ReportStatus.FAILED, data, errors, Instant.now());
    }

    public static Report blocked(String taskId, String unitId, Map<String, Object> data, List<String> reasons) {
        if (reasons == null || reasons.isEmpty()) {
            throw new IllegalArgumentException("A BLOCKED report must carry at least one reason");
        }
        return new Report(taskId, unitId, ReportStatus.BLOCKED, data, reasons, Instant.now());
    }

    public static Report pending(String taskId, String unitId, Map<String, Object> data) {
        return new Report(taskId, unitId, ReportStatus.PENDING, data, List.of(), Instant.now());
    }

    public boolean isCompleted() {
        return status == ReportStatus.COMPLETED;
    }

    /**
     * FAILED or BLOCKED.
     */
    public boolean isUnsuccessful() {
        return status == ReportStatus.FAILED || status == ReportStatus.BLOCKED;
    }

    /**
     * The {@code reason} tag in {@link #data}, if any.
     */
    public String reason() {
        Object reason = data.get("reason");
        return reason != null ? reason.toString() : null;
    }
}
