package dev.lukebemish.testbench.framework.discovery;

import java.util.Objects;

public record PackageSelector(String packageName) implements Selector {
    public PackageSelector {
        Objects.requireNonNull(packageName, "packageName");
    }

    @Override
    public String describe() {
        return Selectors.PACKAGE_PREFIX + packageName;
    }
}
