package com.jobmemory.extract;

/**
 * When entities of both types come out of one message, link each pair.
 */
public record RelationRule(String fromType, String relationType, String toType) {}
