package com.switchboard.core.outreach;

import com.switchboard.core.registry.UnitId;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Reads the latest sentiment insight ({@code INSIGHT/sentiment_<leadId>}) written by conversation
 * analysis. Leads without one are NEUTRAL.
 */
@Component
public class StoredSentimentAnalyzer implements SentimentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StoredSentimentAnalyzer.class);

    private final SharedStore store;

    public StoredSentimentAnalyzer(SharedStore store) {
        this.store = store;
    }

    @Override
    public Sentiment analyze(Lead lead) {
        return store.read(StoreCategory.INSIGHT, "sentiment_" + lead.id(), UnitId.OUTREACH_MANAGER.name())
                .map(entry -> entry.stringValue("sentiment"))
                .map(StoredSentimentAnalyzer::parse)
                .orElse(Sentiment.NEUTRAL);
    }

    private static Sentiment parse(String value) {
        try {
            return Sentiment.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown sentiment value '{}'", value);
            return Sentiment.NEUTRAL;
        }
    }
}
