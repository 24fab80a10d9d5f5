package dev.lukebemish.testbench.framework.execution;

import dev.lukebemish.testbench.framework.model.TestNode;

@FunctionalInterface
public interface LeafInvoker {
    /**
     * Runs the action of a leaf and reports its outcome. Never throws for anything the action does.
     */
    ExecutionResult invoke(TestNode leaf);

    static LeafInvoker direct() {
        return leaf -> {
            try {
                leaf.action().execute();
                return ExecutionResult.successful();
            } catch (Throwable t) {
                if (t instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return ExecutionResult.fromThrowable(t);
            }
        };
    }
}
