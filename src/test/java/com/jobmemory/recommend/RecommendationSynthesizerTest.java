package com.jobmemory.recommend;

import com.jobmemory.graph.JsonFileGraphStore;
import com.jobmemory.query.QueryEngine;
import com.jobmemory.shared.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationSynthesizerTest {

    @TempDir
    Path tempDir;

    private JsonFileGraphStore store;
    private RecommendationSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        store = new JsonFileGraphStore(tempDir.resolve("graph.json"), Duration.ofSeconds(2));
        synthesizer = new RecommendationSynthesizer(new QueryEngine(store), 2);
    }

    @Test
    void emptyGraphGivesFallbacks() {
        assertEquals(List.of(RecommendationSynthesizer.SKILLS_FALLBACK),
                synthesizer.recommend("u1", RecommendationType.SKILLS).items());
        assertEquals(List.of(RecommendationSynthesizer.RESUME_FALLBACK),
                synthesizer.recommend("u1", RecommendationType.RESUME).items());
        assertEquals(RecommendationSynthesizer.INTERVIEW_FALLBACK,
                synthesizer.recommend("u1", RecommendationType.INTERVIEW).items());
        assertEquals(List.of(RecommendationSynthesizer.GENERAL_FALLBACK),
                synthesizer.recommend("u1", RecommendationType.GENERAL).items());
    }

    @Test
    void resumeAdvicePairsSkillsWithRoles() {
        store.upsertEntity("u1", "Python", "skill");
        store.upsertEntity("u1", "Data Engineer", "role");

        var rec = synthesizer.recommend("u1", RecommendationType.RESUME);

        assertEquals("resume", rec.type());
        assertEquals(List.of("Consider highlighting your experience with Python for Data Engineer positions."),
                rec.items());
    }

    @Test
    void resumeAdviceWithSkillsOnly() {
        store.upsertEntity("u1", "Go", "skill");
        assertEquals(List.of("Consider highlighting your experience with Go."),
                synthesizer.recommend("u1", RecommendationType.RESUME).items());
    }

    @Test
    void interviewAdviceNamesCompaniesAndRoles() {
        store.upsertEntity("u1", "SRE", "role");
        store.upsertEntity("u1", "Google", "company");

        assertEquals(List.of(
                "Research Google's products, teams and recent news before interviewing there.",
                "Practice SRE interview questions that Google is known to ask."),
                synthesizer.recommend("u1", RecommendationType.INTERVIEW).items());
    }

    @Test
    void skillsAdviceCoversEverySkill() {
        store.upsertEntity("u1", "Rust", "skill");
        store.upsertEntity("u1", "Kafka", "skill");

        assertThat(synthesizer.recommend("u1", RecommendationType.SKILLS).items())
                .hasSize(2)
                .allMatch(item -> item.startsWith("Keep building on "));
    }

    @Test
    void generalAdviceCapsEachCategoryAndLeadsWithPreferences() {
        store.upsertEntity("u1", "preferences", "preference");
        store.addObservation("u1", "preferences", "remote work");
        store.upsertEntity("u1", "Python", "skill");
        store.upsertEntity("u1", "Java", "skill");
        store.upsertEntity("u1", "Rust", "skill");
        store.upsertEntity("u1", "Backend Engineer", "role");

        var items = synthesizer.recommend("u1", RecommendationType.GENERAL).items();

        assertEquals("You mentioned: remote work", items.get(0));
        assertThat(items).filteredOn(i -> i.startsWith("Keep building on")).hasSize(2);
        assertThat(items).filteredOn(i -> i.startsWith("Consider highlighting")).hasSize(2);
        assertThat(items).noneMatch(RecommendationSynthesizer.INTERVIEW_FALLBACK::contains);
    }

    @Test
    void sameGraphGivesSameAnswer() {
        store.upsertEntity("u1", "Python", "skill");
        store.upsertEntity("u1", "Tencent", "company");

        assertEquals(synthesizer.recommend("u1", RecommendationType.GENERAL),
                synthesizer.recommend("u1", RecommendationType.GENERAL));
    }

    @Test
    void typeParsingDefaultsAndRejects() {
        assertEquals(RecommendationType.GENERAL, RecommendationType.fromWire(null));
        assertEquals(RecommendationType.GENERAL, RecommendationType.fromWire(" "));
        assertEquals(RecommendationType.INTERVIEW, RecommendationType.fromWire("Interview"));
        assertThrows(ValidationException.class, () -> RecommendationType.fromWire("salary"));
    }

    @Test
    void itemsPerCategoryMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new RecommendationSynthesizer(new QueryEngine(store), 0));
    }
}
