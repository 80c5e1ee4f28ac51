package org.pdsync.slack;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.pdsync.config.SyncBotConfig;
import org.pdsync.config.SyncBotConfig.SlackConfig;

import io.quarkus.logging.Log;

/**
 * CDI Producer for SlackService.
 */
@ApplicationScoped
public class SlackServiceProducer {

    @Inject
    SyncBotConfig botConfig;

    /**
     * @return SlackService implementation (application-scoped singleton)
     */
    @Produces
    @ApplicationScoped
    public SlackService slackService() {
        SlackConfig slackConfig = botConfig.slack();

        SlackClient client = RestClientBuilder.newBuilder()
                .baseUri(URI.create(slackConfig.url()))
                .register(new SlackClientFilter(slackConfig.token()))
                .build(SlackClient.class);

        Log.infof("Slack service configured for: %s", slackConfig.url());
        return new SlackServiceImpl(client);
    }
}
