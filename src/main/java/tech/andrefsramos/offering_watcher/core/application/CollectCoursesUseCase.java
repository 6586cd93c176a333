package tech.andrefsramos.offering_watcher.core.application;

import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;

import java.util.Optional;

public interface CollectCoursesUseCase {
    Optional<CollectionOutcome> collectOnce();
}
