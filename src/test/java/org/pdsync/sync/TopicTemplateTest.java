package org.pdsync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.pdsync.TopicTemplateException;

class TopicTemplateTest {

    @Test
    void testToKey() {
        assertThat(TopicTemplate.toKey("Primary Rotation")).isEqualTo("PrimaryRotation");
        assertThat(TopicTemplate.toKey("Secondary-Rotation (EU) #2")).isEqualTo("SecondaryRotationEU2");
        assertThat(TopicTemplate.toKey("abc123")).isEqualTo("abc123");
        assertThat(TopicTemplate.toKey("Ünïcode")).isEqualTo("ncode");
    }

    @Test
    void testRender() {
        TopicTemplate template = TopicTemplate.parse("primary",
                "Primary: <@{PrimaryRotation}> Secondary: <@{SecondaryRotation}>");

        String topic = template.render(Map.of(
                "PrimaryRotation", "U1",
                "SecondaryRotation", "U2"));

        assertThat(topic).isEqualTo("Primary: <@U1> Secondary: <@U2>");
    }

    @Test
    void testRenderUnknownKey() {
        TopicTemplate template = TopicTemplate.parse("primary", "On call: {Tertiary}");

        assertThatThrownBy(() -> template.render(Map.of("PrimaryRotation", "U1")))
                .isInstanceOf(TopicTemplateException.class)
                .hasMessageStartingWith("failed to render template: ");
    }

    @Test
    void testParseError() {
        assertThatThrownBy(() -> TopicTemplate.parse("primary", "{#if PrimaryRotation}on call"))
                .isInstanceOf(TopicTemplateException.class);
    }

    @Test
    void testTemplateIsReusable() {
        TopicTemplate template = TopicTemplate.parse("primary", "{PrimaryRotation}");

        assertThat(template.render(Map.of("PrimaryRotation", "U1"))).isEqualTo("U1");
        assertThat(template.render(Map.of("PrimaryRotation", "U2"))).isEqualTo("U2");
        assertThat(template.name()).isEqualTo("primary");
    }
}
