package org.multibench.matrix;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import org.multibench.plan.TemplatePlaceholders;

/**
 * Substitutes {@code {name}} placeholders from a variable map.
 */
final class TemplateRenderer {
    private final String benchName;
    private final Map<String, String> values;

    TemplateRenderer(String benchName, Map<String, String> values) {
        this.benchName = Objects.requireNonNull(benchName, "benchName");
        this.values = Objects.requireNonNull(values, "values");
    }

    String render(String templatePath, String template) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = TemplatePlaceholders.PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new TemplateException(benchName, templatePath, name);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
