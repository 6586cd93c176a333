package tech.andrefsramos.offering_watcher.core.ports;

import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SnapshotRepository {
    StoredSnapshot save(Snapshot snapshot, Instant takenAt);
    Optional<StoredSnapshot> findLatest();
    Optional<StoredSnapshot> findById(long id);
    Optional<String> findRawJsonById(long id);
    List<SnapshotSummary> listRecent(int limit);
}
