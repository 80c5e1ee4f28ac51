package org.pdsync.pagerduty;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;

/**
 * Adds the headers every PagerDuty API call requires:
 * - Authorization: API token
 * - Accept: versioned media type
 *
 * See: https://developer.pagerduty.com/docs/authentication
 */
public class PagerDutyClientFilter implements ClientRequestFilter {
    static final String ACCEPT = "application/vnd.pagerduty+json;version=2";

    private final String authorization;

    public PagerDutyClientFilter(String token) {
        this.authorization = "Token token=" + token;
    }

    @Override
    public void filter(ClientRequestContext requestContext) {
        requestContext.getHeaders().putSingle(HttpHeaders.AUTHORIZATION, authorization);
        requestContext.getHeaders().putSingle(HttpHeaders.ACCEPT, ACCEPT);
    }
}
