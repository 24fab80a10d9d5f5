package dev.lukebemish.testbench.framework.model;

import org.jspecify.annotations.Nullable;

/**
 * Actions run around the children of a container: {@code before} once the container has started, {@code after}
 * once every child has finished.
 */
public record ContainerLifecycle(@Nullable TestAction before, @Nullable TestAction after) {
    private static final ContainerLifecycle NONE = new ContainerLifecycle(null, null);

    public static ContainerLifecycle none() {
        return NONE;
    }

    public boolean isEmpty() {
        return before == null && after == null;
    }
}
