package com.propplatform.common.exception;

/**
 * Failure inside a single evaluator. The orchestrator catches it and treats the
 * evaluator as abstaining; it never aborts a scoring run.
 */
public class EvaluatorException extends RuntimeException {
    private final String evaluatorName;

    public EvaluatorException(String evaluatorName, String message) {
        super("[" + evaluatorName + "] " + message);
        this.evaluatorName = evaluatorName;
    }

    public EvaluatorException(String evaluatorName, String message, Throwable cause) {
        super("[" + evaluatorName + "] " + message, cause);
        this.evaluatorName = evaluatorName;
    }

    public String getEvaluatorName() {
        return evaluatorName;
    }
}
