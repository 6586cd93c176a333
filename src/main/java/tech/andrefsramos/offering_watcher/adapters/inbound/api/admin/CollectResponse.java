package tech.andrefsramos.offering_watcher.adapters.inbound.api.admin;

import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;

import java.time.Instant;

public record CollectResponse(
        Long snapshotId,
        Long previousSnapshotId,
        Instant takenAt,
        int departments,
        int courses,
        int added,
        int removed,
        int updated
) {
    static CollectResponse from(CollectionOutcome o) {
        return new CollectResponse(o.snapshotId(), o.previousSnapshotId(), o.takenAt(), o.departments(), o.courses(),
                o.diff().addedCount(), o.diff().removedCount(), o.diff().updatedCount());
    }
}
