package com.jobmemory.graph;

import com.jobmemory.shared.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable graph of a single user. Not thread-safe; the owning store guards it.
 * Entities are keyed by lower-cased name and iterate in creation order.
 */
final class UserGraph {

    static final String UNKNOWN_TYPE = "unknown";

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Set<Relation> relations = new LinkedHashSet<>();

    static UserGraph from(KnowledgeGraph snapshot) {
        var graph = new UserGraph();
        for (var e : snapshot.entities()) {
            var node = graph.upsert(e.name(), e.type());
            node.observations.addAll(e.observations());
        }
        for (var r : snapshot.relations()) {
            graph.addRelation(r.from(), r.type(), r.to());
        }
        return graph;
    }

    UserGraph copy() {
        var copy = new UserGraph();
        nodes.forEach((key, node) -> copy.nodes.put(key, node.copy()));
        copy.relations.addAll(relations);
        return copy;
    }

    Node upsert(String name, String type) {
        var trimmed = requireName(name);
        var key = key(trimmed);
        var existing = nodes.get(key);
        if (existing != null) return existing;
        var node = new Node(trimmed, normalizeType(type));
        nodes.put(key, node);
        return node;
    }

    Node find(String name) {
        if (name == null) return null;
        return nodes.get(key(name.trim()));
    }

    boolean addRelation(String from, String type, String to) {
        var relType = type == null ? "" : type.trim();
        if (relType.isEmpty()) throw new ValidationException("relation type is required");
        var fromNode = upsert(from, UNKNOWN_TYPE);
        var toNode = upsert(to, UNKNOWN_TYPE);
        return relations.add(new Relation(fromNode.name, relType, toNode.name));
    }

    boolean removeRelation(String from, String type, String to) {
        var fromNode = find(from);
        var toNode = find(to);
        if (fromNode == null || toNode == null || type == null) return false;
        return relations.remove(new Relation(fromNode.name, type.trim(), toNode.name));
    }

    boolean removeEntity(String name) {
        var node = find(name);
        if (node == null) return false;
        nodes.remove(key(node.name));
        relations.removeIf(r -> r.from().equals(node.name) || r.to().equals(node.name));
        return true;
    }

    boolean isEmpty() {
        return nodes.isEmpty();
    }

    int entityCount() {
        return nodes.size();
    }

    Iterable<Node> nodes() {
        return nodes.values();
    }

    Entity view(Node node) {
        return new Entity(node.name, node.type, node.observations);
    }

    KnowledgeGraph snapshot() {
        var entities = new ArrayList<Entity>(nodes.size());
        for (var node : nodes.values()) entities.add(view(node));
        return new KnowledgeGraph(entities, new ArrayList<>(relations));
    }

    static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("entity name is required");
        }
        return name.trim();
    }

    private static String normalizeType(String type) {
        return type == null || type.isBlank() ? UNKNOWN_TYPE : type.trim();
    }

    static final class Node {
        final String name;
        final String type;
        final List<String> observations = new ArrayList<>();

        private Node(String name, String type) {
            this.name = name;
            this.type = type;
        }

        private Node copy() {
            var copy = new Node(name, type);
            copy.observations.addAll(observations);
            return copy;
        }

        /** Removes the first occurrence of {@code text}; returns whether one was found. */
        boolean removeObservation(String text) {
            return observations.remove(text);
        }

        boolean matches(String lowerQuery) {
            if (name.toLowerCase(Locale.ROOT).contains(lowerQuery)) return true;
            if (type.toLowerCase(Locale.ROOT).contains(lowerQuery)) return true;
            for (var obs : observations) {
                if (obs.toLowerCase(Locale.ROOT).contains(lowerQuery)) return true;
            }
            return false;
        }
    }
}
