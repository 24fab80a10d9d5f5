package dev.lukebemish.testbench.framework.model;

@FunctionalInterface
public interface TestAction {
    void execute() throws Throwable;
}
