package dev.lukebemish.testbench.framework.discovery;

import java.util.Objects;

public record ClassSelector(String className) implements Selector {
    public ClassSelector {
        Objects.requireNonNull(className, "className");
    }

    @Override
    public String describe() {
        return Selectors.CLASS_PREFIX + className;
    }
}
