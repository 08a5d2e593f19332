package com.tarifftracker.notifier.domain.offer;

import java.util.Optional;

/**
 * Read-only view of the offers published by the ingestion job. Empty when no usable snapshot exists.
 */
public interface OfferSnapshotProvider {

    Optional<CurrentOfferSnapshot> current();
}
