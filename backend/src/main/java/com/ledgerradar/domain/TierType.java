package com.ledgerradar.domain;

/**
 * Extraction strategy that produced a job's data. For PDFs, VISION_LLM when any page needed the vision repair.
 */
public enum TierType {
    XML,
    TEXT_LLM,
    VISION_LLM,
    CSV
}
