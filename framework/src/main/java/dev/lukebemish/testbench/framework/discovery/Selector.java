package dev.lukebemish.testbench.framework.discovery;

public sealed interface Selector permits PackageSelector, ClassSelector {
    String describe();
}
