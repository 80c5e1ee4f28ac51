package org.pdsync.pagerduty;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record PagerDutySchedule(String id, String name) {

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\"}".formatted(id, name);
    }
}
