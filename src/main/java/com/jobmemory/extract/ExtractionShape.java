package com.jobmemory.extract;

/**
 * How a rule names the entity that receives the observation.
 */
public enum ExtractionShape {
    /** The matched keyword, or the canonical name its alias points to. */
    KEYWORD,
    /** The matched role word plus the qualifier right before it, e.g. {@code Python工程师}. */
    ROLE_PHRASE,
    /** Always the rule's own entity name, e.g. {@code preferences}. */
    FIXED_ENTITY;

    static ExtractionShape parse(String raw) {
        if (raw == null || raw.isBlank()) return KEYWORD;
        return valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_'));
    }
}
