package com.switchboard.core.registry;

import com.switchboard.core.unit.PlaceholderUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the units that exist in the catalog but have no implementation yet.
 */
@Configuration
public class PlaceholderUnitConfig {

    @Bean
    public PlaceholderUnit linkedInChannelUnit() {
        return new PlaceholderUnit(UnitId.LINKEDIN_CHANNEL.identity());
    }

    @Bean
    public PlaceholderUnit phoneChannelUnit() {
        return new PlaceholderUnit(UnitId.PHONE_CHANNEL.identity());
    }

    @Bean
    public PlaceholderUnit copywriterUnit() {
        return new PlaceholderUnit(UnitId.COPYWRITER.identity());
    }

    @Bean
    public PlaceholderUnit subjectLineWriterUnit() {
        return new PlaceholderUnit(UnitId.SUBJECT_LINE_WRITER.identity());
    }
}
