package com.williamcallahan.markdownlabel.config;

import com.williamcallahan.markdownlabel.domain.render.RenderStyle;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code markdown.*} configuration tree.
 */
@ConfigurationProperties(prefix = "markdown")
public class MarkdownLabelProperties {

    private RenderConfig render = new RenderConfig();
    private ParseCacheConfig cache = new ParseCacheConfig();
    private ParseConfig parse = new ParseConfig();

    public MarkdownLabelProperties() {}

    /**
     * Validates every section; called once after binding.
     */
    @PostConstruct
    public void validateConfiguration() {
        render.validateConfiguration();
        cache.validateConfiguration();
        parse.validateConfiguration();
    }

    /**
     * Builds the configured default style.
     *
     * @return render style
     */
    public RenderStyle toRenderStyle() {
        return render.toRenderStyle();
    }

    public RenderConfig getRender() {
        return render;
    }

    public void setRender(final RenderConfig render) {
        this.render = render == null ? new RenderConfig() : render;
    }

    public ParseCacheConfig getCache() {
        return cache;
    }

    public void setCache(final ParseCacheConfig cache) {
        this.cache = cache == null ? new ParseCacheConfig() : cache;
    }

    public ParseConfig getParse() {
        return parse;
    }

    public void setParse(final ParseConfig parse) {
        this.parse = parse == null ? new ParseConfig() : parse;
    }
}
