package com.evolver.exception;

import com.evolver.capability.FailureKind;

import java.util.Optional;

/**
 * Raised by a capability when an action cannot be carried out.
 * Contained to the DAG branch of the failing node.
 */
public class ActionFailureException extends EvolverException {

    private final FailureKind kind;
    private final String subject;
    private final Object expected;

    public ActionFailureException(FailureKind kind, String reason) {
        this(kind, reason, null, null);
    }

    /**
     * @param kind     failure signature used by reflection
     * @param reason   human readable reason
     * @param subject  missing state key (MISSING_PRECONDITION) or expected predecessor action
     *                 (ORDERING_VIOLATION); may be null
     * @param expected value the missing key should have held; may be null
     */
    public ActionFailureException(FailureKind kind, String reason, String subject, Object expected) {
        super(reason);
        this.kind = kind;
        this.subject = subject;
        this.expected = expected;
    }

    public ActionFailureException(FailureKind kind, String reason, Throwable cause) {
        super(reason, cause);
        this.kind = kind;
        this.subject = null;
        this.expected = null;
    }

    public static ActionFailureException missingPrecondition(String action, String key, Object expected) {
        return new ActionFailureException(FailureKind.MISSING_PRECONDITION,
                action + " requires " + key + "=" + expected, key, expected);
    }

    public static ActionFailureException orderingViolation(String action, String predecessor) {
        return new ActionFailureException(FailureKind.ORDERING_VIOLATION,
                action + " must run after " + predecessor, predecessor, null);
    }

    public FailureKind getKind() {
        return kind;
    }

    public Optional<String> getSubject() {
        return Optional.ofNullable(subject);
    }

    public Optional<Object> getExpected() {
        return Optional.ofNullable(expected);
    }
}
