package tech.andrefsramos.offering_watcher.core.domain;

import java.time.Instant;

public record StoredSnapshot(Long id, Instant takenAt, Snapshot snapshot) {}
