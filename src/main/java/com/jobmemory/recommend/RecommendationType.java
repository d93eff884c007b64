package com.jobmemory.recommend;

import com.jobmemory.shared.error.ValidationException;

import java.util.Locale;

public enum RecommendationType {
    GENERAL, RESUME, INTERVIEW, SKILLS;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Blank means {@link #GENERAL}; anything unrecognised is rejected. */
    public static RecommendationType fromWire(String raw) {
        if (raw == null || raw.isBlank()) return GENERAL;
        for (var t : values()) {
            if (t.wireName().equalsIgnoreCase(raw.trim())) return t;
        }
        throw new ValidationException("Unknown recommendation_type: " + raw
                + " (expected general, resume, interview or skills)");
    }
}
