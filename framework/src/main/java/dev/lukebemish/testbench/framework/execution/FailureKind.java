package dev.lukebemish.testbench.framework.execution;

public enum FailureKind {
    /** An expectation was not met. */
    ASSERTION,
    /** The action threw something other than an assertion or abort signal. */
    EXCEPTION,
    /** The JVM or class loading broke underneath the test, e.g. {@link OutOfMemoryError} or {@link LinkageError}. */
    ENVIRONMENT,
    /** The action stopped itself because a precondition did not hold. */
    ABORTED,
    /** The action did not finish within the configured timeout. */
    TIMEOUT,
    /** A container whose own lifecycle succeeded but one of its descendants did not. */
    DESCENDANT
}
