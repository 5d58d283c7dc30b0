package com.propplatform.common.model;

/** A historical scoring paired with its realised outcome. */
public record CalibrationSample(ScoredProposition scored, Outcome outcome) {}
