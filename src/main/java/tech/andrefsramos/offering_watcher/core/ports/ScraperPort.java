package tech.andrefsramos.offering_watcher.core.ports;

import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;

public interface ScraperPort {
    void openSession();
    int collectDepartment(Department department, Snapshot target);
}
