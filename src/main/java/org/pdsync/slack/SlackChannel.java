package org.pdsync.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackChannel(String id, String name, Topic topic) {

    public String topicValue() {
        return topic == null || topic.value() == null ? "" : topic.value();
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Topic(String value) {
    }

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\"}".formatted(id, name);
    }
}
