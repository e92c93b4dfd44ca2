package com.switchboard.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Defaults for the outreach sequence engine. Sequence documents may override the caps and
 * quiet hours per sequence; mutation directives adjust these defaults at runtime.
 */
@Component
@ConfigurationProperties(prefix = "switchboard.outreach")
public class OutreachProperties {

    private String timeZone = "UTC";
    private int maxContactsPerDay = 3;
    private int maxContactsPerWeek = 10;
    private Integer quietHoursStart = 21;
    private Integer quietHoursEnd = 8;
    private String defaultFallbackChannel = "";

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public int getMaxContactsPerDay() {
        return maxContactsPerDay;
    }

    public void setMaxContactsPerDay(int maxContactsPerDay) {
        this.maxContactsPerDay = maxContactsPerDay;
    }

    public int getMaxContactsPerWeek() {
        return maxContactsPerWeek;
    }

    public void setMaxContactsPerWeek(int maxContactsPerWeek) {
        this.maxContactsPerWeek = maxContactsPerWeek;
    }

    public Integer getQuietHoursStart() {
        return quietHoursStart;
    }

    public void setQuietHoursStart(Integer quietHoursStart) {
        this.quietHoursStart = quietHoursStart;
    }

    public Integer getQuietHoursEnd() {
        return quietHoursEnd;
    }

    public void setQuietHoursEnd(Integer quietHoursEnd) {
        this.quietHoursEnd = quietHoursEnd;
    }

    public String getDefaultFallbackChannel() {
        return defaultFallbackChannel;
    }

    public void setDefaultFallbackChannel(String defaultFallbackChannel) {
        this.defaultFallbackChannel = defaultFallbackChannel;
    }
}
