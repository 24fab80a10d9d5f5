package dev.lukebemish.testbench.framework.execution;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

public final class ExecutionResult {
    public enum Status {
        SUCCESSFUL,
        FAILED,
        ABORTED,
        SKIPPED
    }

    private static final ExecutionResult SUCCESSFUL = new ExecutionResult(Status.SUCCESSFUL, null, null);

    private final Status status;
    private final @Nullable FailureCause failureCause;
    private final @Nullable String skipReason;

    private ExecutionResult(Status status, @Nullable FailureCause failureCause, @Nullable String skipReason) {
        this.status = status;
        this.failureCause = failureCause;
        this.skipReason = skipReason;
    }

    public static ExecutionResult successful() {
        return SUCCESSFUL;
    }

    public static ExecutionResult failed(FailureCause cause) {
        return new ExecutionResult(Status.FAILED, Objects.requireNonNull(cause, "cause"), null);
    }

    public static ExecutionResult aborted(FailureCause cause) {
        return new ExecutionResult(Status.ABORTED, Objects.requireNonNull(cause, "cause"), null);
    }

    public static ExecutionResult skipped(@Nullable String reason) {
        return new ExecutionResult(Status.SKIPPED, null, reason);
    }

    /**
     * Turns whatever a test action threw into a result: aborts and timeouts become {@link Status#ABORTED}, anything
     * else {@link Status#FAILED}.
     */
    public static ExecutionResult fromThrowable(Throwable throwable) {
        var cause = FailureCause.of(throwable);
        return cause.isAbort() ? aborted(cause) : failed(cause);
    }

    public Status getStatus() {
        return status;
    }

    public Optional<FailureCause> getFailureCause() {
        return Optional.ofNullable(failureCause);
    }

    public Optional<Throwable> getThrowable() {
        return getFailureCause().map(FailureCause::throwable);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESSFUL;
    }

    @Override
    public String toString() {
        if (failureCause != null) {
            return status + " (" + failureCause.kind() + ": " + failureCause.message() + ")";
        }
        if (skipReason != null) {
            return status + " (" + skipReason + ")";
        }
        return status.toString();
    }
}
