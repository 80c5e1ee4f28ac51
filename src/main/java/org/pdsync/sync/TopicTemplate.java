package org.pdsync.sync;

import java.util.Map;
import java.util.regex.Pattern;

import org.pdsync.TopicTemplateException;

import io.quarkus.qute.Engine;
import io.quarkus.qute.Template;
import io.quarkus.qute.TemplateException;
import io.quarkus.qute.TemplateInstance;

/**
 * Channel topic template, parsed once and rendered on every run
 * against the Slack user id of the on-call person per schedule.
 * <p>
 * Keys are schedule names with every non-alphanumeric character
 * removed, e.g. {@code Primary: <@{PrimaryRotation}>}.
 * Rendering is strict: a key that is not present fails the render.
 */
public final class TopicTemplate {
    private static final Pattern NOT_ALPHA_NUM = Pattern.compile("[^a-zA-Z0-9]");

    static final Engine ENGINE = Engine.builder()
            .addDefaults()
            .strictRendering(true)
            .build();

    private final String name;
    private final String source;
    private final Template template;

    private TopicTemplate(String name, String source, Template template) {
        this.name = name;
        this.source = source;
        this.template = template;
    }

    /**
     * @param name name used in error messages (usually the sync name)
     * @param source template text
     * @return parsed template
     * @throws TopicTemplateException if the template can not be parsed
     */
    public static TopicTemplate parse(String name, String source) {
        try {
            return new TopicTemplate(name, source, ENGINE.parse(source));
        } catch (TemplateException e) {
            throw new TopicTemplateException(e.getMessage(), e);
        }
    }

    /**
     * Convert a schedule name into the key used in topic templates.
     */
    public static String toKey(String scheduleName) {
        return NOT_ALPHA_NUM.matcher(scheduleName).replaceAll("");
    }

    public String name() {
        return name;
    }

    public String source() {
        return source;
    }

    /**
     * @param values template key to Slack user id
     * @return the rendered topic
     * @throws TopicTemplateException if rendering fails
     */
    public String render(Map<String, String> values) {
        TemplateInstance instance = template.instance();
        values.forEach(instance::data);
        try {
            return instance.render();
        } catch (TemplateException e) {
            throw new TopicTemplateException("failed to render template: %s".formatted(e.getMessage()), e);
        }
    }

    @Override
    public String toString() {
        return "TopicTemplate{name='%s', source='%s'}".formatted(name, source);
    }
}
