package dev.lukebemish.testbench.framework.execution;

public class DescendantFailureException extends RuntimeException {
    private final int failedChildren;

    public DescendantFailureException(int failedChildren, int totalChildren) {
        super(failedChildren + " of " + totalChildren + " children did not succeed", null, false, false);
        this.failedChildren = failedChildren;
    }

    public int getFailedChildren() {
        return failedChildren;
    }
}
