package com.jobmemory.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link RuleTable} from YAML. The bundled table lives on the classpath
 * as {@value #DEFAULT_RESOURCE}; a file configured by the operator replaces it.
 */
public class RuleTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleTableLoader.class);
    static final String DEFAULT_RESOURCE = "extraction-rules.yaml";

    public static RuleTable loadDefault() {
        try (var in = RuleTableLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            return parse(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    /** Loads {@code path} when set and present, otherwise the bundled table. */
    public static RuleTable loadOrDefault(Path path) {
        if (path == null) return loadDefault();
        if (!Files.isRegularFile(path)) {
            log.warn("Rules file {} not found, using bundled rules", path);
            return loadDefault();
        }
        try (var in = Files.newInputStream(path)) {
            var table = parse(in);
            log.info("Loaded {} extraction rules from {}", table.rules().size(), path);
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static RuleTable parse(InputStream in) {
        Map<String, Object> raw = new Yaml().load(in);
        if (raw == null) raw = Map.of();

        var rules = new ArrayList<ExtractionRule>();
        for (var r : (List<Map<String, Object>>) raw.getOrDefault("rules", List.of())) {
            rules.add(new ExtractionRule(
                (String) r.get("name"),
                (String) r.getOrDefault("entity-type", "unknown"),
                ExtractionShape.parse((String) r.get("shape")),
                (String) r.get("entity-name"),
                strings(r.getOrDefault("keywords", List.of())),
                aliases(r.getOrDefault("aliases", Map.of())),
                Boolean.TRUE.equals(r.getOrDefault("job-signal", true))
            ));
        }

        var relations = new ArrayList<RelationRule>();
        for (var r : (List<Map<String, Object>>) raw.getOrDefault("relations", List.of())) {
            relations.add(new RelationRule(
                String.valueOf(r.get("from")),
                String.valueOf(r.get("type")),
                String.valueOf(r.get("to"))
            ));
        }

        return new RuleTable(
            strings(raw.getOrDefault("job-keywords", List.of())),
            strings(raw.getOrDefault("role-qualifiers", List.of())),
            rules,
            relations
        );
    }

    private static List<String> strings(Object value) {
        var out = new ArrayList<String>();
        if (value instanceof List<?> list) {
            for (var item : list) {
                if (item != null) out.add(String.valueOf(item));
            }
        }
        return out;
    }

    private static Map<String, String> aliases(Object value) {
        var out = new LinkedHashMap<String, String>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        }
        return out;
    }
}
