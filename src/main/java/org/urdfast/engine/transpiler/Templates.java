package org.urdfast.engine.transpiler;

import java.util.List;
import java.util.Map;

/**
 * Placeholder substitution for profile templates.
 *
 * Positional templates use {@code {0}}, {@code {1}}, ... ({@code "pow({0}, {1})"});
 * named templates use {@code {name}} ({@code "def {name}({params}):"}).
 * Unknown placeholders are left as they are.
 */
public final class Templates {

    private Templates() {
    }

    public static String positional(String template, List<String> arguments) {
        String result = template;
        for (int i = 0; i < arguments.size(); i++) {
            result = result.replace("{" + i + "}", arguments.get(i));
        }
        return result;
    }

    public static String named(String template, Map<String, String> values) {
        StringBuilder sb = new StringBuilder(template.length() + 32);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            int close = c == '{' ? template.indexOf('}', i) : -1;
            if (close > i) {
                String key = template.substring(i + 1, close);
                String value = values.get(key);
                if (value != null) {
                    sb.append(value);
                    i = close + 1;
                    continue;
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * @return The number of distinct positional placeholders {@code {0}} ..
     *         {@code {n-1}} present in the template
     */
    public static int arity(String template) {
        int n = 0;
        while (template.contains("{" + n + "}")) {
            n++;
        }
        return n;
    }
}
