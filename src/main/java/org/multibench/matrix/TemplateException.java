package org.multibench.matrix;

/**
 * A template placeholder could not be resolved while expanding one bench.
 */
public final class TemplateException extends IllegalArgumentException {
    private final String benchName;
    private final String placeholder;

    public TemplateException(String benchName, String templatePath, String placeholder) {
        super("bench '" + benchName + "': " + templatePath + " references '{" + placeholder
            + "}' which has no axis or base value");
        this.benchName = benchName;
        this.placeholder = placeholder;
    }

    public String benchName() {
        return benchName;
    }

    public String placeholder() {
        return placeholder;
    }
}
