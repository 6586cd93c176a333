package tech.andrefsramos.offering_watcher.core.domain;

import java.time.Instant;

public record SnapshotSummary(Long id, Instant takenAt, int courseCount) {}
