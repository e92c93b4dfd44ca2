package com.switchboard.core.outreach;

/**
 * Boundary to conversation analysis. Consulted once before a sequence's first step.
 */
public interface SentimentAnalyzer {

    Sentiment analyze(Lead lead);
}
