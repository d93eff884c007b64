package com.jobmemory.extract;

import com.jobmemory.graph.GraphDelta;
import com.jobmemory.graph.ObservationFact;
import com.jobmemory.graph.Relation;
import com.jobmemory.graph.UserIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-driven fact extraction from a single user message.
 *
 * <p>A message is only considered when it is job related. Each rule of the table
 * then contributes observations independently; relation rules link the
 * entities that came out of the same message. The output is deterministic for a
 * given table and message.</p>
 */
public class ObservationExtractor {

    private static final Logger log = LoggerFactory.getLogger(ObservationExtractor.class);

    private static final Pattern FRAGMENT_BREAK = Pattern.compile("[。！？!?；;，,、\\n]+|\\.(?=\\s|$)");
    private static final Pattern ASCII_QUALIFIER = Pattern.compile("(?<![A-Za-z0-9+#.])[A-Za-z0-9][A-Za-z0-9+#.]*\\s?$");
    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "as", "be", "is", "am", "are", "was", "for", "of", "to", "and", "or", "my", "i");
    private static final int QUALIFIER_LOOKBACK = 24;

    private final RuleTable table;
    private final List<String> qualifiersLongestFirst;

    public ObservationExtractor(RuleTable table) {
        this.table = table;
        this.qualifiersLongestFirst = table.roleQualifiers().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    public RuleTable table() { return table; }

    public GraphDelta extract(String userId, String message) {
        UserIds.validate(userId);
        if (message == null || message.isBlank() || !isJobRelated(message)) {
            return GraphDelta.empty();
        }

        var facts = new LinkedHashSet<ObservationFact>();
        for (var rule : table.rules()) {
            for (var m : matches(message, rule)) {
                var fragment = fragmentAround(message, m.start);
                var entity = switch (rule.shape()) {
                    case KEYWORD -> rule.canonical(m.text);
                    case ROLE_PHRASE -> rolePhrase(message, m);
                    case FIXED_ENTITY -> rule.entityName();
                };
                facts.add(new ObservationFact(entity, rule.entityType(), fragment));
            }
        }

        var relations = link(facts);
        log.debug("Extracted {} observations, {} relations for user {}", facts.size(), relations.size(), userId);
        return new GraphDelta(List.of(), new ArrayList<>(facts), relations);
    }

    public boolean isJobRelated(String message) {
        for (var kw : table.jobKeywords()) {
            if (indexOfIgnoreCase(message, kw, 0) >= 0) return true;
        }
        for (var rule : table.rules()) {
            if (rule.jobSignal() && !matches(message, rule).isEmpty()) return true;
        }
        return false;
    }

    // --- matching ---

    private record Match(int start, int end, String text) {
        int length() { return end - start; }
        boolean overlaps(Match o) { return start < o.end && o.start < end; }
    }

    /** Non-overlapping keyword hits of one rule, in message order; the longer hit wins an overlap. */
    private List<Match> matches(String message, ExtractionRule rule) {
        var hits = new ArrayList<Match>();
        for (var kw : rule.triggers()) {
            if (kw.isEmpty()) continue;
            int from = 0;
            int idx;
            while ((idx = indexOfIgnoreCase(message, kw, from)) >= 0) {
                if (onWordBoundary(message, idx, idx + kw.length())) {
                    hits.add(new Match(idx, idx + kw.length(), message.substring(idx, idx + kw.length())));
                }
                from = idx + 1;
            }
        }
        hits.sort(Comparator.comparingInt(Match::length).reversed().thenComparingInt(Match::start));
        var accepted = new ArrayList<Match>();
        for (var hit : hits) {
            if (accepted.stream().noneMatch(hit::overlaps)) accepted.add(hit);
        }
        accepted.sort(Comparator.comparingInt(Match::start));
        if (rule.shape() == ExtractionShape.ROLE_PHRASE) return mergeAdjacent(message, accepted);
        return accepted;
    }

    // 开发 + 工程师 -> 开发工程师
    private static List<Match> mergeAdjacent(String message, List<Match> sorted) {
        var merged = new ArrayList<Match>();
        for (var m : sorted) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1).end == m.start) {
                var last = merged.remove(merged.size() - 1);
                merged.add(new Match(last.start, m.end, message.substring(last.start, m.end)));
            } else {
                merged.add(m);
            }
        }
        return merged;
    }

    private String rolePhrase(String message, Match m) {
        int start = qualifierStart(message, m.start);
        return message.substring(start < 0 ? m.start : start, m.end).trim();
    }

    /** Start index of the qualifier ending at {@code end}, or -1 when there is none. */
    private int qualifierStart(String message, int end) {
        var prefix = message.substring(Math.max(0, end - QUALIFIER_LOOKBACK), end);
        for (var q : qualifiersLongestFirst) {
            if (prefix.endsWith(q)) return end - q.length();
        }
        // transparent bounds let the lookbehind see the character before the window
        var ascii = ASCII_QUALIFIER.matcher(message)
                .region(Math.max(0, end - QUALIFIER_LOOKBACK), end)
                .useTransparentBounds(true);
        if (ascii.find()) {
            var token = ascii.group().trim();
            while (token.endsWith(".")) token = token.substring(0, token.length() - 1);
            if (token.isEmpty() || STOPWORDS.contains(token.toLowerCase(Locale.ROOT))) return -1;
            return ascii.start();
        }
        return -1;
    }

    private static String fragmentAround(String message, int index) {
        int start = 0;
        int end = message.length();
        var breaks = FRAGMENT_BREAK.matcher(message);
        while (breaks.find()) {
            if (breaks.end() <= index) {
                start = breaks.end();
            } else if (breaks.start() > index) {
                end = breaks.start();
                break;
            }
        }
        return message.substring(start, end).trim();
    }

    // --- relations ---

    private List<Relation> link(Set<ObservationFact> facts) {
        Map<String, Map<String, String>> byType = new LinkedHashMap<>();
        for (var f : facts) {
            byType.computeIfAbsent(f.entityType(), t -> new LinkedHashMap<>())
                  .putIfAbsent(f.entityName().toLowerCase(Locale.ROOT), f.entityName());
        }
        var relations = new LinkedHashSet<Relation>();
        for (var rule : table.relations()) {
            var froms = byType.getOrDefault(rule.fromType(), Map.of());
            var tos = byType.getOrDefault(rule.toType(), Map.of());
            for (var from : froms.entrySet()) {
                for (var to : tos.entrySet()) {
                    if (from.getKey().equals(to.getKey())) continue;
                    relations.add(new Relation(from.getValue(), rule.relationType(), to.getValue()));
                }
            }
        }
        return new ArrayList<>(relations);
    }

    // --- text helpers ---

    static int indexOfIgnoreCase(String text, String needle, int from) {
        int last = text.length() - needle.length();
        for (int i = Math.max(0, from); i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) return i;
        }
        return -1;
    }

    private static boolean onWordBoundary(String text, int start, int end) {
        if (isAsciiWordChar(text.charAt(start)) && start > 0 && isAsciiWordChar(text.charAt(start - 1))) {
            return false;
        }
        return !(isAsciiWordChar(text.charAt(end - 1)) && end < text.length() && isAsciiWordChar(text.charAt(end)));
    }

    private static boolean isAsciiWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
