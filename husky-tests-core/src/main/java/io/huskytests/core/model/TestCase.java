package io.huskytests.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A discovered test case.
 *
 * @param fullyQualifiedName e.g. {@code com.example.FooTest.returnsBar}
 * @param displayName        name shown to the user; defaults to the method part of the FQN
 * @param traits             trait name to values, e.g. {@code Category -> [Slow]}
 */
public record TestCase(String fullyQualifiedName, String displayName, Map<String, List<String>> traits) {

    public static final String FULLY_QUALIFIED_NAME = "FullyQualifiedName";
    public static final String NAME = "Name";
    public static final String DISPLAY_NAME = "DisplayName";
    public static final String CLASS_NAME = "ClassName";

    public TestCase {
        if (fullyQualifiedName == null || fullyQualifiedName.isBlank()) {
            throw new IllegalArgumentException("fullyQualifiedName must not be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = methodName(fullyQualifiedName);
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (traits != null) {
            traits.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        }
        traits = Map.copyOf(copy);
    }

    public static TestCase of(String fullyQualifiedName) {
        return new TestCase(fullyQualifiedName, null, Map.of());
    }

    public String className() {
        String stripped = stripArguments(fullyQualifiedName);
        int dot = stripped.lastIndexOf('.');
        return dot < 0 ? "" : stripped.substring(0, dot);
    }

    /**
     * Values a filter condition on {@code property} is evaluated against.
     * Property names are matched case-insensitively; unknown properties yield no values.
     */
    public List<String> propertyValues(String property) {
        String key = property.toLowerCase(Locale.ROOT);
        switch (key) {
            case "fullyqualifiedname":
                return List.of(fullyQualifiedName);
            case "name":
            case "displayname":
                return List.of(displayName);
            case "classname":
                return List.of(className());
            default:
                List<String> values = new ArrayList<>();
                for (var entry : traits.entrySet()) {
                    if (entry.getKey().equalsIgnoreCase(property)) {
                        values.addAll(entry.getValue());
                    }
                }
                return values;
        }
    }

    private static String methodName(String fqn) {
        String stripped = stripArguments(fqn);
        int dot = stripped.lastIndexOf('.');
        return dot < 0 ? fqn : fqn.substring(dot + 1);
    }

    private static String stripArguments(String fqn) {
        int paren = fqn.indexOf('(');
        return paren < 0 ? fqn : fqn.substring(0, paren);
    }
}
