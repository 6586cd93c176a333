package tech.andrefsramos.offering_watcher.core.domain;

public enum Role {
    ADMIN
}
