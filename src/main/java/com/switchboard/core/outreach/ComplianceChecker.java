package com.switchboard.core.outreach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a lead may be contacted now. Every condition is evaluated so the decision lists
 * all failures, not just the first.
 */
@Component
public class ComplianceChecker {

    private static final Logger log = LoggerFactory.getLogger(ComplianceChecker.class);

    private final SuppressionList suppressionList;
    private final ContactHistory contactHistory;
    private final Clock clock;

    public ComplianceChecker(SuppressionList suppressionList, ContactHistory contactHistory, Clock clock) {
        this.suppressionList = suppressionList;
        this.contactHistory = contactHistory;
        this.clock = clock;
    }

    /**
     * @param settings   per-sequence overrides
     * @param parameters engine defaults used where the settings leave a value unset
     */
    public ComplianceDecision canContact(Lead lead, ComplianceSettings settings, OutreachParameters parameters) {
        ComplianceSettings s = settings != null ? settings : ComplianceSettings.defaults();
        List<String> reasons = new ArrayList<>(suppressionReasons(lead, s));
        Instant now = clock.instant();

        int dayCap = s.maxContactsPerDay() != null ? s.maxContactsPerDay() : parameters.maxContactsPerDay();
        long lastDay = contactHistory.countContactsSince(lead.id(), now.minus(Duration.ofHours(24)));
        if (lastDay >= dayCap) {
            reasons.add("Daily contact limit reached (" + lastDay + "/" + dayCap + ")");
        }

        int weekCap = s.maxContactsPerWeek() != null ? s.maxContactsPerWeek() : parameters.maxContactsPerWeek();
        long lastWeek = contactHistory.countContactsSince(lead.id(), now.minus(Duration.ofDays(7)));
        if (lastWeek >= weekCap) {
            reasons.add("Weekly contact limit reached (" + lastWeek + "/" + weekCap + ")");
        }

        if (quietWindowEnd(s, parameters).isPresent()) {
            reasons.add(String.format("Within quiet hours (%02d:00-%02d:00 %s)", quietStart(s, parameters),
                    quietEnd(s, parameters), parameters.timeZone()));
        }

        if (!reasons.isEmpty()) {
            log.info("Lead {} may not be contacted: {}", lead.id(), reasons);
        }
        return ComplianceDecision.of(reasons);
    }

    /**
     * Do-not-contact and unsubscribe reasons only. Checked again before every later step, since a
     * lead can opt out while a sequence is waiting.
     */
    public List<String> suppressionReasons(Lead lead, ComplianceSettings settings) {
        ComplianceSettings s = settings != null ? settings : ComplianceSettings.defaults();
        List<String> reasons = new ArrayList<>();
        if (s.respectsDnc() && (lead.doNotContact() || suppressionList.isDoNotContact(lead.id()))) {
            reasons.add("Lead " + lead.id() + " is on the do-not-contact list");
        }
        if (lead.unsubscribed() || suppressionList.isUnsubscribed(lead.id())) {
            reasons.add("Lead " + lead.id() + " has unsubscribed");
        }
        return reasons;
    }

    /**
     * When the current time falls in quiet hours, the instant the window closes; otherwise empty.
     */
    public Optional<Instant> quietWindowEnd(ComplianceSettings settings, OutreachParameters parameters) {
        ComplianceSettings s = settings != null ? settings : ComplianceSettings.defaults();
        Integer start = quietStart(s, parameters);
        Integer end = quietEnd(s, parameters);
        ZonedDateTime now = clock.instant().atZone(parameters.timeZone());
        if (!inQuietHours(now.getHour(), start, end)) {
            return Optional.empty();
        }
        ZonedDateTime windowEnd = now.truncatedTo(ChronoUnit.HOURS).withHour(end);
        if (!windowEnd.isAfter(now)) {
            windowEnd = windowEnd.plusDays(1);
        }
        return Optional.of(windowEnd.toInstant());
    }

    private static Integer quietStart(ComplianceSettings s, OutreachParameters parameters) {
        return s.quietHoursStart() != null ? s.quietHoursStart() : parameters.quietHoursStart();
    }

    private static Integer quietEnd(ComplianceSettings s, OutreachParameters parameters) {
        return s.quietHoursEnd() != null ? s.quietHoursEnd() : parameters.quietHoursEnd();
    }

    /**
     * Quiet hours are {@code [start, end)}, wrapping midnight when start is after end.
     */
    static boolean inQuietHours(int hour, Integer start, Integer end) {
        if (start == null || end == null || start.equals(end)) {
            return false;
        }
        if (start < end) {
            return hour >= start && hour < end;
        }
        return hour >= start || hour < end;
    }
}
