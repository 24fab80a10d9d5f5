package dev.lukebemish.testbench.framework.discovery;

import java.util.ArrayList;
import java.util.List;

public final class Selectors {
    static final String PACKAGE_PREFIX = "package:";
    static final String CLASS_PREFIX = "class:";

    private Selectors() {}

    public static PackageSelector selectPackage(String packageName) {
        return new PackageSelector(packageName);
    }

    public static ClassSelector selectClass(String className) {
        return new ClassSelector(className);
    }

    public static ClassSelector selectClass(Class<?> type) {
        return new ClassSelector(type.getName());
    }

    /**
     * Parses the textual form of a selector, {@code package:<name>} or {@code class:<name>}.
     */
    public static Selector parse(String text) {
        var trimmed = text.trim();
        if (trimmed.startsWith(PACKAGE_PREFIX)) {
            return selectPackage(trimmed.substring(PACKAGE_PREFIX.length()).trim());
        }
        if (trimmed.startsWith(CLASS_PREFIX)) {
            return selectClass(trimmed.substring(CLASS_PREFIX.length()).trim());
        }
        throw new DiscoveryException("Unrecognized selector '" + text + "'; expected 'package:<name>' or 'class:<name>'");
    }

    public static List<Selector> parseAll(List<String> texts) {
        var selectors = new ArrayList<Selector>(texts.size());
        for (String text : texts) {
            if (!text.isBlank()) {
                selectors.add(parse(text));
            }
        }
        return selectors;
    }
}
