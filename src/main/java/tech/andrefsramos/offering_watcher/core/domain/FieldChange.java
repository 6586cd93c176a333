package tech.andrefsramos.offering_watcher.core.domain;

public record FieldChange(Object oldValue, Object newValue) {}
