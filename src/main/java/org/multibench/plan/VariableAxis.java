package org.multibench.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One named sweep dimension of a bench matrix. Declaration order of axes and of values is significant.
 */
public record VariableAxis(String name, List<String> values) {
    public VariableAxis {
        name = Objects.requireNonNull(name, "name").trim();
        values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    public static VariableAxis of(final String name, final String... values) {
        return new VariableAxis(name, List.of(values));
    }

    static VariableAxis fromMap(final Map<String, Object> root, final String path) {
        final String name = ConfigValues.requireText(root.get("name"), path + ".name");
        final List<Object> rawValues = ConfigValues.asList(root.get("values"), path + ".values");
        final List<String> values = new ArrayList<>(rawValues.size());
        for (int i = 0; i < rawValues.size(); i++) {
            values.add(ConfigValues.scalarText(rawValues.get(i), path + ".values[" + i + "]"));
        }
        return new VariableAxis(name, values);
    }

    public int size() {
        return values.size();
    }
}
