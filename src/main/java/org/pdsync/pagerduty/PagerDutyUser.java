package org.pdsync.pagerduty;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import io.quarkus.runtime.annotations.RegisterForReflection;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public record PagerDutyUser(String id, String name, String email) {

    @Override
    public String toString() {
        return "{ID:%s Name:\"%s\" Email:%s}".formatted(id, name, email);
    }
}
