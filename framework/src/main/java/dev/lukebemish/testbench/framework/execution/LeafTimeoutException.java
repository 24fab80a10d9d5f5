package dev.lukebemish.testbench.framework.execution;

import java.time.Duration;

public class LeafTimeoutException extends RuntimeException {
    public LeafTimeoutException(String displayName, Duration timeout) {
        super(displayName + " timed out after " + timeout);
    }
}
