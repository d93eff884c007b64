package com.jobmemory.graph;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmemory.shared.error.NotFoundException;
import com.jobmemory.shared.error.PersistenceException;
import com.jobmemory.shared.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Graph store backed by a single JSON document mapping user id to
 * {@code {entities, relations}}.
 *
 * <p>All users share one fair read/write lock. A mutation runs against a copy of
 * the user's graph, the whole store is written to a temp file and renamed over
 * the old one, and only then does the copy replace the live graph. Lock waits are
 * bounded; running out of time raises {@link PersistenceException}.</p>
 */
public class JsonFileGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileGraphStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<LinkedHashMap<String, KnowledgeGraph>> FILE_TYPE = new TypeReference<>() {};
    private static final long FILE_LOCK_RETRY_MS = 20;

    private final Path file;
    private final Path lockFile;
    private final long lockTimeoutMs;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final Map<String, UserGraph> graphs = new LinkedHashMap<>();

    public JsonFileGraphStore(Path file, Duration lockTimeout) {
        this.file = file.toAbsolutePath();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.lockTimeoutMs = lockTimeout.toMillis();
        load();
    }

    public Path file() { return file; }

    // --- writes ---

    @Override
    public Entity upsertEntity(String userId, String name, String type) {
        return write(userId, g -> g.view(g.upsert(name, type)));
    }

    @Override
    public void addObservation(String userId, String name, String text) {
        addObservations(userId, name, List.of(requireText(text)));
    }

    @Override
    public void addObservations(String userId, String name, List<String> texts) {
        texts.forEach(JsonFileGraphStore::requireText);
        write(userId, g -> g.upsert(name, UserGraph.UNKNOWN_TYPE).observations.addAll(texts));
    }

    @Override
    public boolean addRelation(String userId, String from, String relationType, String to) {
        return write(userId, g -> g.addRelation(from, relationType, to));
    }

    @Override
    public ApplyResult apply(String userId, GraphDelta delta) {
        return write(userId, g -> {
            var names = new ArrayList<String>();
            for (var decl : delta.entities()) {
                names.add(g.upsert(decl.name(), decl.type()).name);
            }
            int added = 0;
            for (var fact : delta.observations()) {
                g.upsert(fact.entityName(), fact.entityType()).observations.add(requireText(fact.text()));
                added++;
            }
            var created = new ArrayList<Relation>();
            var existing = new ArrayList<Relation>();
            for (var r : delta.relations()) {
                boolean isNew = g.addRelation(r.from(), r.type(), r.to());
                var stored = new Relation(g.find(r.from()).name, r.type().trim(), g.find(r.to()).name);
                (isNew ? created : existing).add(stored);
            }
            return new ApplyResult(names, added, created, existing);
        });
    }

    @Override
    public boolean deleteEntity(String userId, String name) {
        return write(userId, g -> g.removeEntity(name));
    }

    @Override
    public DeleteResult<String> deleteEntities(String userId, List<String> names) {
        return write(userId, g -> {
            var deleted = new ArrayList<String>();
            var notFound = new ArrayList<String>();
            for (var name : names) {
                (g.removeEntity(name) ? deleted : notFound).add(name);
            }
            return new DeleteResult<>(deleted, notFound);
        });
    }

    @Override
    public int deleteObservations(String userId, String name, List<String> texts) {
        return write(userId, g -> {
            var node = g.find(name);
            if (node == null) throw new NotFoundException("Entity not found: " + name);
            int removed = 0;
            for (var text : texts) {
                if (node.removeObservation(text)) removed++;
            }
            return removed;
        });
    }

    @Override
    public boolean deleteRelation(String userId, String from, String relationType, String to) {
        return write(userId, g -> g.removeRelation(from, relationType, to));
    }

    @Override
    public DeleteResult<Relation> deleteRelations(String userId, List<Relation> relations) {
        return write(userId, g -> {
            var deleted = new ArrayList<Relation>();
            var notFound = new ArrayList<Relation>();
            for (var r : relations) {
                (g.removeRelation(r.from(), r.type(), r.to()) ? deleted : notFound).add(r);
            }
            return new DeleteResult<>(deleted, notFound);
        });
    }

    @Override
    public boolean clear(String userId) {
        UserIds.validate(userId);
        acquire(lock.writeLock(), "write");
        try {
            if (!graphs.containsKey(userId)) return false;
            persist(userId, null);
            graphs.remove(userId);
            log.info("Cleared knowledge graph of user {}", userId);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- reads ---

    @Override
    public KnowledgeGraph readGraph(String userId) {
        return read(userId, g -> g == null ? KnowledgeGraph.empty() : g.snapshot());
    }

    @Override
    public List<Entity> searchNodes(String userId, String query) {
        if (query == null || query.isBlank()) throw new ValidationException("query is required");
        var lower = query.trim().toLowerCase(Locale.ROOT);
        return read(userId, g -> {
            var results = new ArrayList<Entity>();
            if (g == null) return results;
            for (var node : g.nodes()) {
                if (node.matches(lower)) results.add(g.view(node));
            }
            return results;
        });
    }

    @Override
    public List<Entity> openNodes(String userId, Collection<String> names) {
        var keys = new HashSet<String>();
        for (var name : names) {
            if (name != null && !name.isBlank()) keys.add(UserGraph.key(name.trim()));
        }
        return read(userId, g -> {
            var results = new ArrayList<Entity>();
            if (g == null) return results;
            for (var node : g.nodes()) {
                if (keys.contains(UserGraph.key(node.name))) results.add(g.view(node));
            }
            return results;
        });
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("observation text must not be empty");
        }
        return text;
    }

    // --- locking ---

    /** Runs {@code mutation} on a copy under the write lock and commits it once saved. */
    <T> T write(String userId, Function<UserGraph, T> mutation) {
        UserIds.validate(userId);
        acquire(lock.writeLock(), "write");
        try {
            var current = graphs.get(userId);
            var working = current != null ? current.copy() : new UserGraph();
            var result = mutation.apply(working);
            var next = working.isEmpty() ? null : working;
            persist(userId, next);
            if (next == null) graphs.remove(userId);
            else graphs.put(userId, next);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(String userId, Function<UserGraph, T> query) {
        UserIds.validate(userId);
        acquire(lock.readLock(), "read");
        try {
            return query.apply(graphs.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void acquire(Lock l, String mode) {
        try {
            if (!l.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new PersistenceException(
                        "Timed out after " + lockTimeoutMs + "ms waiting for the graph store " + mode + " lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PersistenceException("Interrupted while waiting for the graph store " + mode + " lock", e);
        }
    }

    // --- persistence ---

    /** Writes every graph to disk, with {@code replacement} standing in for {@code userId} (null drops it). */
    private void persist(String userId, UserGraph replacement) {
        var snapshot = new LinkedHashMap<String, KnowledgeGraph>();
        graphs.forEach((id, g) -> {
            if (!id.equals(userId)) snapshot.put(id, g.snapshot());
        });
        if (replacement != null) snapshot.put(userId, replacement.snapshot());

        try {
            Files.createDirectories(file.getParent());
            try (var channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 var ignored = acquireFileLock(channel)) {
                var tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
                try {
                    writeFully(tmp, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot));
                    moveIntoPlace(tmp);
                } finally {
                    Files.deleteIfExists(tmp);
                }
            }
            log.debug("Saved knowledge graph: {} users -> {}", snapshot.size(), file);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save knowledge graph to " + file + ": " + e.getMessage(), e);
        }
    }

    private FileLock acquireFileLock(FileChannel channel) throws IOException {
        long deadline = System.currentTimeMillis() + lockTimeoutMs;
        while (true) {
            var held = tryFileLock(channel);
            if (held != null) return held;
            if (System.currentTimeMillis() >= deadline) {
                throw new PersistenceException(
                        "Timed out after " + lockTimeoutMs + "ms waiting for file lock " + lockFile);
            }
            try {
                Thread.sleep(FILE_LOCK_RETRY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PersistenceException("Interrupted while waiting for file lock " + lockFile, e);
            }
        }
    }

    private static FileLock tryFileLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // another channel in this JVM holds it
            return null;
        }
    }

    private static void writeFully(Path target, byte[] bytes) throws IOException {
        try (var channel = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            var buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) channel.write(buffer);
            channel.force(true);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No knowledge graph at {}, starting empty", file);
            return;
        }
        try {
            var raw = readFile();
            int entities = 0;
            for (var entry : raw.entrySet()) {
                var snapshot = entry.getValue() != null ? entry.getValue() : KnowledgeGraph.empty();
                warnDanglingRelations(entry.getKey(), snapshot);
                var graph = UserGraph.from(snapshot);
                if (graph.isEmpty()) continue;
                graphs.put(entry.getKey(), graph);
                entities += graph.entityCount();
            }
            log.info("Loaded knowledge graph: {} users, {} entities", graphs.size(), entities);
        } catch (RuntimeException e) {
            graphs.clear();
            log.warn("Knowledge graph at {} is unreadable, starting empty: {}", file, e.getMessage());
            quarantine();
        }
    }

    private Map<String, KnowledgeGraph> readFile() {
        try {
            Map<String, KnowledgeGraph> raw = MAPPER.readValue(file.toFile(), FILE_TYPE);
            return raw != null ? raw : Map.of();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + file + ": " + e.getMessage(), e);
        }
    }

    private void warnDanglingRelations(String userId, KnowledgeGraph snapshot) {
        var names = new HashSet<String>();
        snapshot.entities().forEach(e -> names.add(UserGraph.key(e.name().trim())));
        for (var r : snapshot.relations()) {
            if (!names.contains(UserGraph.key(r.from().trim())) || !names.contains(UserGraph.key(r.to().trim()))) {
                log.warn("User {}: relation {} references a missing entity, creating it", userId, r);
            }
        }
    }

    private void quarantine() {
        var aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, aside);
            log.warn("Moved unreadable knowledge graph to {}", aside);
        } catch (IOException e) {
            log.warn("Could not move unreadable knowledge graph aside: {}", e.getMessage());
        }
    }
}
