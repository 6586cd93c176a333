package tech.andrefsramos.offering_watcher.core.ports;

import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;

public interface NotificationPort {
    void notifyChanges(ChangeReport report);
}
