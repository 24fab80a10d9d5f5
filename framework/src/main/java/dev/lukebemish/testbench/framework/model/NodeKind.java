package dev.lukebemish.testbench.framework.model;

public enum NodeKind {
    CONTAINER,
    LEAF
}
