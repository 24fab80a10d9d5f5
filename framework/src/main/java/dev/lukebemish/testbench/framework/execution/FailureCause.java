package dev.lukebemish.testbench.framework.execution;

import org.opentest4j.TestAbortedException;

import java.util.Objects;

public record FailureCause(FailureKind kind, Throwable throwable) {
    public FailureCause {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(throwable, "throwable");
    }

    public static FailureCause of(Throwable throwable) {
        return new FailureCause(classify(throwable), throwable);
    }

    public static FailureKind classify(Throwable throwable) {
        if (throwable instanceof LeafTimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (throwable instanceof TestAbortedException) {
            return FailureKind.ABORTED;
        }
        if (throwable instanceof AssertionError) {
            return FailureKind.ASSERTION;
        }
        if (throwable instanceof VirtualMachineError || throwable instanceof LinkageError) {
            return FailureKind.ENVIRONMENT;
        }
        return FailureKind.EXCEPTION;
    }

    public String message() {
        var message = throwable.getMessage();
        return message == null ? throwable.getClass().getName() : message;
    }

    public boolean isAbort() {
        return kind == FailureKind.ABORTED || kind == FailureKind.TIMEOUT;
    }
}
