package com.jobmemory.extract;

import com.jobmemory.graph.ObservationFact;
import com.jobmemory.graph.Relation;
import com.jobmemory.shared.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

class ObservationExtractorTest {

    private final ObservationExtractor extractor = new ObservationExtractor(RuleTableLoader.loadDefault());

    @Test
    void extractsSkillRoleAndPreferenceFromChineseMessage() {
        var message = "我想找一个Python工程师的工作";
        var delta = extractor.extract("u1", message);

        assertThat(delta.observations()).containsExactly(
                new ObservationFact("Python", "skill", message),
                new ObservationFact("Python工程师", "role", message),
                new ObservationFact("preferences", "preference", message));
        assertEquals(List.of(new Relation("Python工程师", "requires", "Python")), delta.relations());
    }

    @Test
    void smallTalkYieldsNothing() {
        assertTrue(extractor.extract("u1", "今天天气真好").isEmpty());
        assertFalse(extractor.isJobRelated("今天天气真好"));
    }

    @Test
    void preferenceAloneDoesNotMakeAMessageJobRelated() {
        assertFalse(extractor.isJobRelated("我喜欢吃火锅"));
    }

    @Test
    void skillMentionAloneIsJobRelated() {
        assertTrue(extractor.isJobRelated("Kubernetes is fun"));
    }

    @Test
    void englishMessageLinksRoleToCompanyAndSkill() {
        var delta = extractor.extract("u1",
                "I have 5 years of Java experience and want to join Google as a backend engineer");

        assertThat(delta.observations()).extracting(ObservationFact::entityName, ObservationFact::entityType)
                .contains(
                        tuple("Java", "skill"),
                        tuple("backend engineer", "role"),
                        tuple("Google", "company"),
                        tuple("experience", "experience"),
                        tuple("preferences", "preference"));
        assertThat(delta.relations()).containsExactly(
                new Relation("backend engineer", "at", "Google"),
                new Relation("backend engineer", "requires", "Java"));
    }

    @Test
    void shortKeywordsRespectWordBoundaries() {
        var delta = extractor.extract("u1", "I want a job at Google");

        assertThat(delta.observations()).extracting(ObservationFact::entityName)
                .doesNotContain("Go")
                .contains("Google");
    }

    @Test
    void longerKeywordWinsOverlap() {
        var delta = extractor.extract("u1", "My job is mostly JavaScript and Spring Boot");

        assertThat(delta.observations()).extracting(ObservationFact::entityName)
                .contains("JavaScript", "Spring Boot")
                .doesNotContain("Java", "Spring");
    }

    @Test
    void aliasesMapToCanonicalNames() {
        var delta = extractor.extract("u1", "面试官问了很多k8s和golang的问题，我想去字节");

        assertThat(delta.observations()).extracting(ObservationFact::entityName)
                .contains("Kubernetes", "Go", "字节跳动");
    }

    @Test
    void adjacentRoleWordsMergeWithQualifier() {
        var delta = extractor.extract("u1", "我是后端开发工程师，有三年经验");

        assertThat(delta.observations())
                .filteredOn(f -> f.entityType().equals("role"))
                .extracting(ObservationFact::entityName)
                .containsExactly("后端开发工程师");
    }

    @Test
    void qualifierTokenIsTakenWhole() {
        assertThat(roles("I'm a 3D designer")).containsExactly("3D designer");
        assertThat(roles("Looking for a job as C++ developer")).containsExactly("C++ developer");
    }

    private List<String> roles(String message) {
        return extractor.extract("u1", message).observations().stream()
                .filter(f -> f.entityType().equals("role"))
                .map(ObservationFact::entityName)
                .toList();
    }

    @Test
    void observationTextIsTheFragmentAroundTheMatch() {
        var delta = extractor.extract("u1", "我会Python。我想去腾讯工作");

        assertThat(delta.observations()).contains(
                new ObservationFact("Python", "skill", "我会Python"),
                new ObservationFact("腾讯", "company", "我想去腾讯工作"));
    }

    @Test
    void repeatedMentionsProduceOneObservationPerFragment() {
        var delta = extractor.extract("u1", "Java job, Java job");

        assertThat(delta.observations())
                .filteredOn(f -> f.entityName().equals("Java"))
                .hasSize(1);
    }

    @Test
    void extractionIsDeterministic() {
        var message = "我在阿里做Java后端开发，想跳槽到腾讯做架构师";
        assertEquals(extractor.extract("u1", message), extractor.extract("u1", message));
    }

    @Test
    void invalidUserIdIsRejected() {
        assertThrows(ValidationException.class, () -> extractor.extract(" ", "Java job"));
    }

    @Test
    void indexOfIgnoreCaseFindsMixedCase() {
        assertEquals(4, ObservationExtractor.indexOfIgnoreCase("I'm PYTHON dev", "python", 0));
        assertEquals(-1, ObservationExtractor.indexOfIgnoreCase("short", "longer needle", 0));
    }
}
