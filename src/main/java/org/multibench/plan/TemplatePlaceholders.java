package org.multibench.plan;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder syntax shared by every configuration template: {@code {name}}.
 *
 * <p>A brace group directly preceded by {@code $} is shell parameter expansion ({@code ${HOME}}) and is left
 * untouched.
 */
public final class TemplatePlaceholders {
    public static final Pattern PLACEHOLDER = Pattern.compile("(?<!\\$)\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private TemplatePlaceholders() {}

    public static Set<String> names(final String template) {
        final Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        final Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
