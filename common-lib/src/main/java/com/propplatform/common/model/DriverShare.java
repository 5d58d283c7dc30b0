package com.propplatform.common.model;

/**
 * A top contributing evaluator ("driver") and its share of the total pull,
 * as a percentage in [0, 100].
 */
public record DriverShare(String evaluator, double contributionPct) {}
