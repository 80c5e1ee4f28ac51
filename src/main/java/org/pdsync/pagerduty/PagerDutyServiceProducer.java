package org.pdsync.pagerduty;

import java.net.URI;
import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.rest.client.RestClientBuilder;
import org.pdsync.config.SyncBotConfig;
import org.pdsync.config.SyncBotConfig.PagerDutyConfig;

import io.quarkus.logging.Log;

/**
 * CDI Producer for PagerDutyService.
 */
@ApplicationScoped
public class PagerDutyServiceProducer {

    @Inject
    SyncBotConfig botConfig;

    /**
     * @return PagerDutyService implementation (application-scoped singleton)
     */
    @Produces
    @ApplicationScoped
    public PagerDutyService pagerDutyService() {
        PagerDutyConfig pdConfig = botConfig.pagerduty();

        PagerDutyClient client = RestClientBuilder.newBuilder()
                .baseUri(URI.create(pdConfig.url()))
                .followRedirects(true)
                .register(new PagerDutyClientFilter(pdConfig.token()))
                .build(PagerDutyClient.class);

        Log.infof("PagerDuty service configured for: %s", pdConfig.url());
        return new PagerDutyServiceImpl(client, Clock.systemUTC());
    }
}
