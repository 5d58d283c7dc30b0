package com.propplatform.common.model;

/**
 * Realised result of a proposition.
 *
 * @param hit whether the wagered side won
 */
public record Outcome(String propositionId, double actualValue, boolean hit) {}
