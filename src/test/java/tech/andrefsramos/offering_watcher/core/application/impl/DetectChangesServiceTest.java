package tech.andrefsramos.offering_watcher.core.application.impl;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseUpdate;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.FieldChange;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;

import static org.assertj.core.api.Assertions.assertThat;
import static tech.andrefsramos.offering_watcher.core.domain.CourseFixtures.course;
import static tech.andrefsramos.offering_watcher.core.domain.CourseFixtures.withRegistered;

class DetectChangesServiceTest {

    private final DetectChangesService service = new DetectChangesService();

    @Test
    void detectsAddedAndUpdatedGroupedByDepartment() {
        Course x = course("101", 1, "X", 30, "CS");
        Course y = course("102", 1, "Y", 0, "CS");
        Snapshot old = Snapshot.of(x);
        Snapshot now = Snapshot.of(withRegistered(x, 32), y);

        DiffResult diff = service.diff(old, now);

        assertThat(diff.added()).containsOnlyKeys("CS");
        assertThat(diff.added().get("CS")).containsOnlyKeys("102-1");
        assertThat(diff.removed()).isEmpty();

        CourseUpdate update = diff.updated().get("CS").get("101-1");
        assertThat(update.name()).isEqualTo("X");
        assertThat(update.changes()).containsOnlyKeys("Registered");
        assertThat(update.changes().get("Registered")).isEqualTo(new FieldChange(30, 32));
    }

    @Test
    void identicalSnapshotsProduceEmptyDiff() {
        Snapshot s = Snapshot.of(course("101", 1, "X", 30, "CS"), course("102", 1, "Y", 0, "EE"));

        assertThat(service.diff(s, s).isEmpty()).isTrue();
        assertThat(service.diff(new Snapshot(), new Snapshot())).isEqualTo(DiffResult.EMPTY);
    }

    @Test
    void swappingSidesSwapsAddedAndRemoved() {
        Snapshot a = Snapshot.of(course("101", 1, "X", 30, "CS"));
        Snapshot b = Snapshot.of(course("101", 1, "X", 30, "CS"), course("201", 1, "M", 0, "Physics"));

        DiffResult forward = service.diff(a, b);
        DiffResult backward = service.diff(b, a);

        assertThat(forward.added()).isEqualTo(backward.removed());
        assertThat(forward.removed()).isEqualTo(backward.added());
    }

    @Test
    void removedUsesDepartmentOfOldRecord() {
        Snapshot old = Snapshot.of(course("103", 1, "Z", 0, "Math"));

        DiffResult diff = service.diff(old, new Snapshot());

        assertThat(diff.removed()).containsOnlyKeys("Math");
        assertThat(diff.removedCount()).isEqualTo(1);
    }

    @Test
    void updatedUsesDepartmentOfNewRecord() {
        Course old = course("101", 1, "X", 30, "CS");
        Course moved = course("101", 1, "X", 30, "EE");

        DiffResult diff = service.diff(Snapshot.of(old), Snapshot.of(moved));

        assertThat(diff.updated()).containsOnlyKeys("EE");
        assertThat(diff.updated().get("EE").get("101-1").changes()).containsOnlyKeys("Department");
    }

    @Test
    void missingDepartmentGroupsUnderUnknown() {
        DiffResult diff = service.diff(new Snapshot(), Snapshot.of(course("999", 1, "Q", 0, null)));

        assertThat(diff.added()).containsOnlyKeys(DetectChangesService.UNKNOWN_DEPARTMENT);
    }

    @Test
    void emptyDepartmentIsKeptAsItsOwnGroup() {
        DiffResult diff = service.diff(new Snapshot(), Snapshot.of(course("999", 1, "Q", 0, "")));

        assertThat(diff.added()).containsOnlyKeys("");
    }

    @Test
    void nullSnapshotsAreTreatedAsEmpty() {
        DiffResult diff = service.diff(null, Snapshot.of(course("101", 1, "X", 30, "CS")));

        assertThat(diff.addedCount()).isEqualTo(1);
    }
}
