package com.jobmemory.recommend;

import com.jobmemory.graph.Entity;
import com.jobmemory.graph.KnowledgeGraph;
import com.jobmemory.query.QueryEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns what is stored about a user into advice. Items are built from fixed
 * templates in entity creation order, so the same graph always gives the same
 * answer.
 */
public class RecommendationSynthesizer {

    static final String SKILLS_FALLBACK =
            "Share more about the skills you have so we can suggest which ones to strengthen.";
    static final String RESUME_FALLBACK =
            "Tell us about your skills and the roles you are targeting to get resume suggestions.";
    static final List<String> INTERVIEW_FALLBACK = List.of(
            "Prepare a short self-introduction that links your experience to the role.",
            "Practice answering behavioral questions with the STAR method.",
            "Prepare a few questions to ask the interviewer about the team and the work.");
    static final String GENERAL_FALLBACK =
            "There is not enough information yet. Share more about your job search to get specific advice.";

    private final QueryEngine queries;
    private final int generalItemsPerCategory;

    public RecommendationSynthesizer(QueryEngine queries, int generalItemsPerCategory) {
        if (generalItemsPerCategory < 1) {
            throw new IllegalArgumentException("generalItemsPerCategory must be >= 1");
        }
        this.queries = queries;
        this.generalItemsPerCategory = generalItemsPerCategory;
    }

    public Recommendation recommend(String userId, RecommendationType type) {
        var graph = queries.readGraph(userId);
        var items = switch (type) {
            case SKILLS -> skills(graph).items;
            case RESUME -> resume(graph).items;
            case INTERVIEW -> interview(graph).items;
            case GENERAL -> general(graph);
        };
        return new Recommendation(type.wireName(), items);
    }

    private record Section(List<String> items, boolean fallback) {
        static Section of(List<String> items) { return new Section(items, false); }
        static Section fallback(List<String> items) { return new Section(items, true); }
    }

    private Section skills(KnowledgeGraph graph) {
        var skills = names(graph, "skill");
        if (skills.isEmpty()) return Section.fallback(List.of(SKILLS_FALLBACK));
        var items = new ArrayList<String>();
        for (var skill : skills) {
            items.add("Keep building on " + skill + ": show it in a recent project or certification.");
        }
        return Section.of(items);
    }

    private Section resume(KnowledgeGraph graph) {
        var skills = names(graph, "skill");
        var roles = names(graph, "role");
        var items = new ArrayList<String>();
        if (!skills.isEmpty() && !roles.isEmpty()) {
            for (var role : roles) {
                for (var skill : skills) {
                    items.add("Consider highlighting your experience with " + skill + " for " + role + " positions.");
                }
            }
        } else if (!skills.isEmpty()) {
            for (var skill : skills) {
                items.add("Consider highlighting your experience with " + skill + ".");
            }
        } else if (!roles.isEmpty()) {
            for (var role : roles) {
                items.add("Tailor your resume to " + role + " positions and list the tools you use in that role.");
            }
        } else {
            return Section.fallback(List.of(RESUME_FALLBACK));
        }
        return Section.of(items);
    }

    private Section interview(KnowledgeGraph graph) {
        var companies = names(graph, "company");
        if (companies.isEmpty()) return Section.fallback(INTERVIEW_FALLBACK);
        var roles = names(graph, "role");
        var items = new ArrayList<String>();
        for (var company : companies) {
            items.add("Research " + company + "'s products, teams and recent news before interviewing there.");
            for (var role : roles) {
                items.add("Practice " + role + " interview questions that " + company + " is known to ask.");
            }
        }
        return Section.of(items);
    }

    private List<String> general(KnowledgeGraph graph) {
        var items = new ArrayList<String>();
        var preferences = new ArrayList<String>();
        for (var e : QueryEngine.entitiesOfType(graph, "preference")) {
            for (var obs : e.observations()) preferences.add("You mentioned: " + obs);
        }
        items.addAll(capped(preferences));
        for (var section : List.of(skills(graph), resume(graph), interview(graph))) {
            if (!section.fallback) items.addAll(capped(section.items));
        }
        return items.isEmpty() ? List.of(GENERAL_FALLBACK) : items;
    }

    private List<String> capped(List<String> items) {
        return items.subList(0, Math.min(items.size(), generalItemsPerCategory));
    }

    private static List<String> names(KnowledgeGraph graph, String type) {
        return QueryEngine.entitiesOfType(graph, type).stream().map(Entity::name).toList();
    }
}
