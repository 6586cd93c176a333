package tech.andrefsramos.offering_watcher.core.domain;

import java.time.Instant;

/** Resumo de uma passada de coleta concluída. {@code previousSnapshotId} é null na primeira passada. */
public record CollectionOutcome(
        Long snapshotId,
        Long previousSnapshotId,
        Instant takenAt,
        int departments,
        int courses,
        DiffResult diff
) {}
