package tech.andrefsramos.offering_watcher.core.application;

import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary;

import java.util.List;
import java.util.Optional;

public interface QuerySnapshotsUseCase {
    List<SnapshotSummary> listRecent(int limit);
    Optional<String> rawJson(long id);
    Optional<ChangeReport> compare(long fromId, long toId);
}
