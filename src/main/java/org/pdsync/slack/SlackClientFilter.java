package org.pdsync.slack;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;

/**
 * Adds the bot token to every Slack Web API request.
 */
public class SlackClientFilter implements ClientRequestFilter {
    private final String authorization;

    public SlackClientFilter(String token) {
        this.authorization = "Bearer " + token;
    }

    @Override
    public void filter(ClientRequestContext requestContext) {
        requestContext.getHeaders().putSingle(HttpHeaders.AUTHORIZATION, authorization);
    }
}
