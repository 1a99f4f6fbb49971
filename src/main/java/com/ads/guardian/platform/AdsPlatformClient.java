package com.ads.guardian.platform;

import java.util.Collection;
import java.util.Map;

/**
 * Advertising platform operations used by the guardian.
 */
public interface AdsPlatformClient {

    /**
     * Fetch metrics for the given entities. Every requested id is expected in the result,
     * either with a snapshot or with the error that prevented fetching it.
     */
    Map<String, FetchOutcome> fetchMetrics(Collection<String> entityIds, ReportingWindow window);

    /**
     * Set the serving status of an entity. Calls repeated with the same idempotency key
     * take effect at most once.
     *
     * @throws PlatformException when the platform rejects or fails the update
     */
    StatusUpdateAck setEntityStatus(String entityId, PlatformStatus targetStatus, String idempotencyKey);
}
