package com.pipeline.transform;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {placeholder}} occurrences in a template string.
 * <p>
 * What happens to a placeholder the lookup cannot answer is decided by the renderer's
 * {@link MissingKeyPolicy}, never by the lookup itself. Text that does not match the placeholder
 * pattern is copied through untouched, so a malformed brace never fails a render.
 */
public final class TemplateRenderer {

    /**
     * Decides how unresolved placeholders are rendered.
     */
    public enum MissingKeyPolicy {
        /** Unresolved placeholders render as the empty string. */
        EMPTY,
        /** Unresolved placeholders are left in the output exactly as written. */
        KEEP_LITERAL
    }

    private static final Pattern SIMPLE_PLACEHOLDER =
            Pattern.compile("\\{(\\w+)}", Pattern.UNICODE_CHARACTER_CLASS);

    private static final TemplateRenderer INPUT_TEMPLATES =
            new TemplateRenderer(SIMPLE_PLACEHOLDER, MissingKeyPolicy.EMPTY);

    private final Pattern placeholder;
    private final MissingKeyPolicy missingKeyPolicy;

    /**
     * @param placeholder      pattern whose first group is the lookup key
     * @param missingKeyPolicy rendering of keys the lookup answers with {@code null}
     */
    public TemplateRenderer(Pattern placeholder, MissingKeyPolicy missingKeyPolicy) {
        this.placeholder = placeholder;
        this.missingKeyPolicy = missingKeyPolicy;
    }

    /**
     * Renderer for {@code {name}} placeholders that substitutes missing names with "".
     */
    public static TemplateRenderer simple() {
        return INPUT_TEMPLATES;
    }

    /**
     * @param template the template text, may be {@code null}
     * @param lookup   returns the replacement text for a key, or {@code null} when the key is unknown
     * @return the rendered text
     */
    public String render(String template, Function<String, String> lookup) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = placeholder.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String replacement = lookup.apply(matcher.group(1));
            if (replacement == null) {
                replacement = missingKeyPolicy == MissingKeyPolicy.EMPTY ? "" : matcher.group(0);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
