package org.pdsync.sync;

import java.util.List;

/**
 * The resolved syncs of one run, and the resolver built from the
 * Slack data fetched for that run.
 */
public record SyncPlan(IdentityResolver resolver, List<RunSlackSync> syncs) {
}
