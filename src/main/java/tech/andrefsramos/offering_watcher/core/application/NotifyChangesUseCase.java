package tech.andrefsramos.offering_watcher.core.application;

import tech.andrefsramos.offering_watcher.core.domain.DiffResult;

import java.time.Instant;

public interface NotifyChangesUseCase {
    void notifyChanges(Instant from, Instant to, DiffResult diff);
}
