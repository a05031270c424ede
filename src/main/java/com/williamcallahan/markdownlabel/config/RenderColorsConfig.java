package com.williamcallahan.markdownlabel.config;

import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import com.williamcallahan.markdownlabel.domain.render.Rgba;

import java.util.List;
import java.util.Locale;

/**
 * Render colors, each bound as four RGBA components in the unit interval.
 */
public class RenderColorsConfig {

    private static final String LINK_KEY = "markdown.render.colors.link";
    private static final String CODE_BACKGROUND_KEY = "markdown.render.colors.code-background";
    private static final String BODY_KEY = "markdown.render.colors.body";
    private static final String DISABLED_KEY = "markdown.render.colors.disabled";
    private static final int COMPONENT_COUNT = 4;
    private static final String NULL_COLOR_FMT = "%s must not be null.";
    private static final String COMPONENTS_FMT = "%s must have exactly 4 components, got %d.";
    private static final String RANGE_FMT = "%s components must be between 0 and 1.";

    private List<Double> link = RenderStyle.DEFAULT_LINK_COLOR.components();
    private List<Double> codeBackground = RenderStyle.DEFAULT_CODE_BACKGROUND.components();
    private List<Double> body = RenderStyle.DEFAULT_BODY_COLOR.components();
    private List<Double> disabled = RenderStyle.DEFAULT_DISABLED_COLOR.components();

    public RenderColorsConfig() {}

    /**
     * Validates that every color has four unit-interval components.
     */
    public void validateConfiguration() {
        requireColor(LINK_KEY, link);
        requireColor(CODE_BACKGROUND_KEY, codeBackground);
        requireColor(BODY_KEY, body);
        requireColor(DISABLED_KEY, disabled);
    }

    public List<Double> getLink() {
        return link;
    }

    public void setLink(final List<Double> link) {
        this.link = requireNonNullColor(LINK_KEY, link);
    }

    public List<Double> getCodeBackground() {
        return codeBackground;
    }

    public void setCodeBackground(final List<Double> codeBackground) {
        this.codeBackground = requireNonNullColor(CODE_BACKGROUND_KEY, codeBackground);
    }

    public List<Double> getBody() {
        return body;
    }

    public void setBody(final List<Double> body) {
        this.body = requireNonNullColor(BODY_KEY, body);
    }

    public List<Double> getDisabled() {
        return disabled;
    }

    public void setDisabled(final List<Double> disabled) {
        this.disabled = requireNonNullColor(DISABLED_KEY, disabled);
    }

    Rgba linkColor() {
        return Rgba.fromComponents(link);
    }

    Rgba codeBackgroundColor() {
        return Rgba.fromComponents(codeBackground);
    }

    Rgba bodyColor() {
        return Rgba.fromComponents(body);
    }

    Rgba disabledColor() {
        return Rgba.fromComponents(disabled);
    }

    private static void requireColor(final String propertyKey, final List<Double> components) {
        requireNonNullColor(propertyKey, components);
        if (components.size() != COMPONENT_COUNT) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, COMPONENTS_FMT, propertyKey, components.size()));
        }
        for (Double component : components) {
            if (component == null || component.isNaN() || component < 0.0 || component > 1.0) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, RANGE_FMT, propertyKey));
            }
        }
    }

    private static List<Double> requireNonNullColor(final String propertyKey, final List<Double> components) {
        if (components == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_COLOR_FMT, propertyKey));
        }
        return components;
    }
}
