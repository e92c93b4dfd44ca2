package com.switchboard.core.outreach;

import com.switchboard.core.config.OutreachProperties;
import com.switchboard.core.model.MutationDirective;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operating parameters of the sequence engine that mutation directives may change.
 * {@link #apply} is pure: it returns a new instance or throws for invalid parameters.
 */
public record OutreachParameters(
    ZoneId timeZone,
    int maxContactsPerDay,
    int maxContactsPerWeek,
    Integer quietHoursStart,
    Integer quietHoursEnd,
    Channel defaultFallbackChannel
) {

    public static final String SEND_TIME_OPTIMIZATION = "SEND_TIME_OPTIMIZATION";
    public static final String FREQUENCY_CAP = "FREQUENCY_CAP";
    public static final String CHANNEL_PREFERENCE = "CHANNEL_PREFERENCE";

    public static OutreachParameters from(OutreachProperties properties) {
        return new OutreachParameters(
                ZoneId.of(properties.getTimeZone()),
                properties.getMaxContactsPerDay(),
                properties.getMaxContactsPerWeek(),
                properties.getQuietHoursStart(),
                properties.getQuietHoursEnd(),
                Channel.fromValue(properties.getDefaultFallbackChannel()));
    }

    public OutreachParameters apply(MutationDirective directive) {
        Map<String, Object> params = directive.parameters();
        return switch (directive.type()) {
            case SEND_TIME_OPTIMIZATION -> new OutreachParameters(
                    params.containsKey("timeZone") ? zone(params.get("timeZone")) : timeZone,
                    maxContactsPerDay, maxContactsPerWeek,
                    hour(params, "quietHoursStart", quietHoursStart),
                    hour(params, "quietHoursEnd", quietHoursEnd),
                    defaultFallbackChannel);
            case FREQUENCY_CAP -> {
                int day = cap(params, "maxContactsPerDay", maxContactsPerDay);
                int week = cap(params, "maxContactsPerWeek", maxContactsPerWeek);
                if (day > week) {
                    throw new IllegalArgumentException("maxContactsPerDay (" + day
                            + ") cannot exceed maxContactsPerWeek (" + week + ")");
                }
                yield new OutreachParameters(timeZone, day, week, quietHoursStart, quietHoursEnd, defaultFallbackChannel);
            }
            case CHANNEL_PREFERENCE -> {
                Object channel = params.get("fallbackChannel");
                yield new OutreachParameters(timeZone, maxContactsPerDay, maxContactsPerWeek,
                        quietHoursStart, quietHoursEnd, channel != null ? Channel.fromValue(channel.toString()) : null);
            }
            default -> throw new IllegalArgumentException("Unsupported mutation type " + directive.type());
        };
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timeZone", timeZone.getId());
        map.put("maxContactsPerDay", maxContactsPerDay);
        map.put("maxContactsPerWeek", maxContactsPerWeek);
        map.put("quietHoursStart", quietHoursStart);
        map.put("quietHoursEnd", quietHoursEnd);
        map.put("defaultFallbackChannel", defaultFallbackChannel != null ? defaultFallbackChannel.name() : null);
        return map;
    }

    private static ZoneId zone(Object value) {
        try {
            return ZoneId.of(String.valueOf(value));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid time zone: " + value, e);
        }
    }

    private static Integer hour(Map<String, Object> params, String name, Integer current) {
        if (!params.containsKey(name)) {
            return current;
        }
        Object value = params.get(name);
        if (value == null) {
            return null;
        }
        int hour = toInt(name, value);
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(name + " must be within 0..23, was " + hour);
        }
        return hour;
    }

    private static int cap(Map<String, Object> params, String name, int current) {
        if (params.get(name) == null) {
            return current;
        }
        int value = toInt(name, params.get(name));
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, was " + value);
        }
        return value;
    }

    private static int toInt(String name, Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
