package com.brainfusion.common.learning;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.KnowledgeType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of external knowledge feed, with the content key holding its items and the
 * knowledge type its items become once validated.
 */
public enum ExternalKnowledgeSource {
    BEST_PRACTICES("practices", KnowledgeType.DECISION_STRATEGY, null),
    DOCUMENTATION("documentation", KnowledgeType.CONTEXT_UNDERSTANDING, null),
    INDUSTRY_STANDARDS("standards", KnowledgeType.DECISION_STRATEGY, "security_and_compliance"),
    SECURITY_ADVISORIES("advisories", KnowledgeType.ERROR_HANDLING, "security_and_compliance");

    private final String itemsKey;
    private final KnowledgeType knowledgeType;
    private final String smeDomain;

    ExternalKnowledgeSource(String itemsKey, KnowledgeType knowledgeType, String smeDomain) {
        this.itemsKey      = itemsKey;
        this.knowledgeType = knowledgeType;
        this.smeDomain     = smeDomain;
    }

    public String itemsKey() {
        return itemsKey;
    }

    public KnowledgeType knowledgeType() {
        return knowledgeType;
    }

    /** Fixed target brain for this feed, or {@code null} when the target depends on the item. */
    public String fixedTarget() {
        return smeDomain == null ? null : BrainDescriptor.smeBrainId(smeDomain);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExternalKnowledgeSource fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("External knowledge source type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown external knowledge source type: " + value, e);
        }
    }
}
