package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.execution.FailureKind;
import dev.lukebemish.testbench.framework.model.TestNode;

import java.io.PrintWriter;
import java.util.concurrent.atomic.AtomicBoolean;

public class FailurePrintingListener implements ExecutionListener {
    private final PrintWriter err;
    private final AtomicBoolean hasFailures = new AtomicBoolean(false);

    public FailurePrintingListener(PrintWriter err) {
        this.err = err;
    }

    public boolean hasFailures() {
        return hasFailures.get();
    }

    @Override
    public void executionFinished(TestNode node, ExecutionResult result) {
        if (result.getStatus() != ExecutionResult.Status.FAILED) {
            return;
        }
        var cause = result.getFailureCause().orElseThrow();
        if (cause.kind() == FailureKind.DESCENDANT) {
            return;
        }
        hasFailures.set(true);
        err.println(node.displayName() + ": failed with " + cause.throwable() + " (" + node.source() + ")");
        cause.throwable().printStackTrace(err);
        err.flush();
    }
}
