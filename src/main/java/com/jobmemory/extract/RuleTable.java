package com.jobmemory.extract;

import java.util.List;

/**
 * The data the extractor runs on. Swap the table to change what gets stored.
 *
 * @param jobKeywords    plain substrings that mark a message as job related
 * @param roleQualifiers words that may precede a role word and belong to its name
 * @param rules          extraction rules, applied in order
 * @param relations      relation rules applied after all extraction rules
 */
public record RuleTable(List<String> jobKeywords,
                        List<String> roleQualifiers,
                        List<ExtractionRule> rules,
                        List<RelationRule> relations) {

    public RuleTable {
        jobKeywords = jobKeywords == null ? List.of() : List.copyOf(jobKeywords);
        roleQualifiers = roleQualifiers == null ? List.of() : List.copyOf(roleQualifiers);
        rules = rules == null ? List.of() : List.copyOf(rules);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }
}
