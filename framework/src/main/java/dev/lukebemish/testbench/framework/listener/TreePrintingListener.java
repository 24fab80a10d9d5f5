package dev.lukebemish.testbench.framework.listener;

import dev.lukebemish.testbench.framework.execution.ExecutionResult;
import dev.lukebemish.testbench.framework.model.TestNode;

import java.io.PrintWriter;

public class TreePrintingListener implements ExecutionListener {
    private static final String INDENT = "  ";

    private final PrintWriter out;

    public TreePrintingListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void executionStarted(TestNode node) {
        if (node.isContainer()) {
            out.println(INDENT.repeat(node.depth()) + node.displayName());
            out.flush();
        }
    }

    @Override
    public void executionFinished(TestNode node, ExecutionResult result) {
        if (node.isLeaf()) {
            out.println(INDENT.repeat(node.depth()) + node.displayName() + " " + marker(result));
        } else if (!result.isSuccessful()) {
            out.println(INDENT.repeat(node.depth()) + node.displayName() + " finished " + marker(result));
        }
        out.flush();
    }

    static String marker(ExecutionResult result) {
        return switch (result.getStatus()) {
            case SUCCESSFUL -> "[OK]";
            case FAILED -> "[FAILED] " + result.getFailureCause().map(cause -> cause.message()).orElse("");
            case ABORTED -> "[ABORTED] " + result.getFailureCause().map(cause -> cause.message()).orElse("");
            case SKIPPED -> "[SKIPPED] " + result.getSkipReason().orElse("");
        };
    }
}
