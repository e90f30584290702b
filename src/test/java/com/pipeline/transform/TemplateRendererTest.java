package com.pipeline.transform;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    @Test
    void simple_shouldRenderMissingKeysAsEmpty() {
        Map<String, String> values = Map.of("query", "pizza");

        String rendered = TemplateRenderer.simple().render("'{query}' near {place}", values::get);

        assertThat(rendered).isEqualTo("'pizza' near ");
    }

    @Test
    void keepLiteral_shouldLeaveUnknownPlaceholdersUntouched() {
        TemplateRenderer renderer = new TemplateRenderer(Pattern.compile("\\{(\\w+\\.\\w+)}"),
                TemplateRenderer.MissingKeyPolicy.KEEP_LITERAL);

        String rendered = renderer.render("{a.b}-{c.d}", key -> key.equals("a.b") ? "x" : null);

        assertThat(rendered).isEqualTo("x-{c.d}");
    }

    @Test
    void render_shouldCopyMalformedBracesAndSpecialCharacters() {
        String rendered = TemplateRenderer.simple().render("{ open {name} $1 \\", key -> "v");

        assertThat(rendered).isEqualTo("{ open v $1 \\");
    }

    @Test
    void render_shouldTreatNullTemplateAsEmpty() {
        assertThat(TemplateRenderer.simple().render(null, key -> "x")).isEmpty();
    }
}
