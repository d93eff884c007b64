package com.jobmemory.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One row of the rule table: which words trigger it and what entity they feed.
 *
 * @param name       label used in logs
 * @param entityType type given to entities this rule creates
 * @param shape      how the entity is named
 * @param entityName target entity for {@link ExtractionShape#FIXED_ENTITY}, else null
 * @param keywords   trigger words, matched case-insensitively
 * @param aliases    extra trigger words mapped to a canonical entity name
 * @param jobSignal  whether a match alone marks the message as job related
 */
public record ExtractionRule(String name,
                             String entityType,
                             ExtractionShape shape,
                             String entityName,
                             List<String> keywords,
                             Map<String, String> aliases,
                             boolean jobSignal) {

    public ExtractionRule {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        var lowered = new LinkedHashMap<String, String>();
        if (aliases != null) aliases.forEach((k, v) -> lowered.put(k.toLowerCase(Locale.ROOT), v));
        aliases = Map.copyOf(lowered);
        if (shape == ExtractionShape.FIXED_ENTITY && (entityName == null || entityName.isBlank())) {
            throw new IllegalArgumentException("Rule '" + name + "' needs an entity name");
        }
    }

    List<String> triggers() {
        var all = new ArrayList<String>(keywords);
        all.addAll(aliases.keySet());
        return all;
    }

    String canonical(String keyword) {
        var alias = aliases.get(keyword.toLowerCase(Locale.ROOT));
        if (alias != null) return alias;
        for (var k : keywords) {
            if (k.equalsIgnoreCase(keyword)) return k;
        }
        return keyword;
    }
}
