package com.propplatform.common.validation;

import com.propplatform.common.exception.ValidationException;
import com.propplatform.common.model.Proposition;
import com.propplatform.common.model.PropositionContext;

/**
 * Structural checks run before any evaluator sees a proposition.
 * Statistics inside the context are not validated.
 */
public final class PropositionValidator {

    private PropositionValidator() {}

    public static void validate(Proposition proposition) {
        if (proposition == null) {
            throw new ValidationException("proposition", "must not be null");
        }
        requireText("id", proposition.id());
        requireText("entity", proposition.entity());
        requireText("team", proposition.team());
        requireText("opponent", proposition.opponent());
        if (proposition.team().equals(proposition.opponent())) {
            throw new ValidationException("opponent", "must differ from team " + proposition.team());
        }
        requireNonNull("position", proposition.position());
        requireNonNull("category", proposition.category());
        requireNonNull("side", proposition.side());
        if (!Double.isFinite(proposition.line()) || proposition.line() < 0.0) {
            throw new ValidationException("line", "must be a finite non-negative number, was " + proposition.line());
        }
    }

    public static void validate(Proposition proposition, PropositionContext context) {
        validate(proposition);
        if (context == null) {
            throw new ValidationException("context", "must not be null for proposition " + proposition.id());
        }
        if (context.propositionId() != null && !context.propositionId().equals(proposition.id())) {
            throw new ValidationException("context.propositionId",
                "context for " + context.propositionId() + " supplied with proposition " + proposition.id());
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "must not be blank");
        }
    }

    private static void requireNonNull(String field, Object value) {
        if (value == null) {
            throw new ValidationException(field, "must not be null");
        }
    }
}
