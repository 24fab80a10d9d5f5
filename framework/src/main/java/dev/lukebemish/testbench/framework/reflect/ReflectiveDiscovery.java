package dev.lukebemish.testbench.framework.reflect;

import dev.lukebemish.testbench.framework.discovery.DiscoveryEngine;

import java.lang.reflect.Method;

public final class ReflectiveDiscovery {
    public static final String ENGINE_ID = "testbench";
    public static final String DISPLAY_NAME = "Testbench";

    private ReflectiveDiscovery() {}

    public static DiscoveryEngine<Class<?>, Method> engine() {
        return new DiscoveryEngine<>(ENGINE_ID, DISPLAY_NAME, new ReflectiveCandidateResolver());
    }
}
