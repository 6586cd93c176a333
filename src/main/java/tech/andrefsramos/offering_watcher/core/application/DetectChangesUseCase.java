package tech.andrefsramos.offering_watcher.core.application;

import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;

public interface DetectChangesUseCase {
    DiffResult diff(Snapshot previous, Snapshot current);
}
