package tech.andrefsramos.offering_watcher.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.offering_watcher.core.application.NotifyChangesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;
import tech.andrefsramos.offering_watcher.core.ports.ScraperPort;
import tech.andrefsramos.offering_watcher.core.ports.SnapshotRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static tech.andrefsramos.offering_watcher.core.domain.CourseFixtures.course;

@ExtendWith(MockitoExtension.class)
class CollectCoursesServiceTest {

    private static final Instant PREVIOUS_AT = Instant.parse("2025-01-20T09:30:00Z");
    private static final Instant NOW = Instant.parse("2025-01-20T10:00:00Z");

    private final Department cs = new Department(40, "مهندسی_کامپیوتر");
    private final Department ee = new Department(25, "مهندسی_برق");

    @Mock
    private ScraperPort scraper;
    @Mock
    private SnapshotRepository repository;
    @Mock
    private NotifyChangesUseCase notifier;

    private CollectCoursesService service;

    @BeforeEach
    void setUp() {
        service = new CollectCoursesService(scraper, List.of(cs, ee), new DetectChangesService(), notifier,
                repository, 0, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstPassOnlyArchives() {
        when(scraper.collectDepartment(eq(cs), any())).thenAnswer(inv -> {
            inv.<Snapshot>getArgument(1).put(course("101", 1, "X", 30, "مهندسی کامپیوتر"));
            return 1;
        });
        when(scraper.collectDepartment(eq(ee), any())).thenReturn(0);
        when(repository.findLatest()).thenReturn(Optional.empty());
        when(repository.save(any(), eq(NOW))).thenAnswer(inv -> new StoredSnapshot(1L, NOW, inv.getArgument(0)));

        Optional<CollectionOutcome> outcome = service.collectOnce();

        assertThat(outcome).isPresent();
        assertThat(outcome.get().snapshotId()).isEqualTo(1L);
        assertThat(outcome.get().previousSnapshotId()).isNull();
        assertThat(outcome.get().courses()).isEqualTo(1);
        assertThat(outcome.get().departments()).isEqualTo(2);
        assertThat(outcome.get().diff().isEmpty()).isTrue();
        verify(scraper).openSession();
        verifyNoInteractions(notifier);
    }

    @Test
    void secondPassNotifiesDifferences() {
        Snapshot previous = Snapshot.of(course("101", 1, "X", 30, "CS"));
        when(scraper.collectDepartment(eq(cs), any())).thenAnswer(inv -> {
            Snapshot target = inv.getArgument(1);
            target.put(course("101", 1, "X", 32, "CS"));
            target.put(course("102", 1, "Y", 0, "CS"));
            return 2;
        });
        when(scraper.collectDepartment(eq(ee), any())).thenReturn(0);
        when(repository.findLatest()).thenReturn(Optional.of(new StoredSnapshot(7L, PREVIOUS_AT, previous)));
        when(repository.save(any(), eq(NOW))).thenAnswer(inv -> new StoredSnapshot(8L, NOW, inv.getArgument(0)));

        CollectionOutcome outcome = service.collectOnce().orElseThrow();

        ArgumentCaptor<DiffResult> diff = ArgumentCaptor.forClass(DiffResult.class);
        verify(notifier).notifyChanges(eq(PREVIOUS_AT), eq(NOW), diff.capture());
        assertThat(diff.getValue().addedCount()).isEqualTo(1);
        assertThat(diff.getValue().updatedCount()).isEqualTo(1);
        assertThat(outcome.previousSnapshotId()).isEqualTo(7L);
        assertThat(outcome.snapshotId()).isEqualTo(8L);
    }

    @Test
    void unchangedPassDoesNotNotify() {
        Snapshot previous = Snapshot.of(course("101", 1, "X", 30, "CS"));
        when(scraper.collectDepartment(eq(cs), any())).thenAnswer(inv -> {
            inv.<Snapshot>getArgument(1).put(course("101", 1, "X", 30, "CS"));
            return 1;
        });
        when(scraper.collectDepartment(eq(ee), any())).thenReturn(0);
        when(repository.findLatest()).thenReturn(Optional.of(new StoredSnapshot(7L, PREVIOUS_AT, previous)));
        when(repository.save(any(), eq(NOW))).thenAnswer(inv -> new StoredSnapshot(8L, NOW, inv.getArgument(0)));

        service.collectOnce();

        verifyNoInteractions(notifier);
        verify(repository).save(any(), eq(NOW));
    }

    @Test
    void loginFailureAbortsWithoutArchiving() {
        doThrow(new IllegalStateException("login recusado")).when(scraper).openSession();

        assertThatThrownBy(() -> service.collectOnce()).hasMessageContaining("login recusado");

        verify(scraper, never()).collectDepartment(any(), any());
        verifyNoInteractions(repository, notifier);
    }

    @Test
    void departmentFailureAbortsWholePass() {
        when(scraper.collectDepartment(eq(cs), any())).thenReturn(3);
        when(scraper.collectDepartment(eq(ee), any())).thenThrow(new IllegalStateException("redirected to login"));

        assertThatThrownBy(() -> service.collectOnce()).isInstanceOf(IllegalStateException.class);

        verifyNoInteractions(repository, notifier);
    }

    @Test
    void passCanRunAgainAfterFailure() {
        doThrow(new IllegalStateException("timeout")).doNothing().when(scraper).openSession();
        when(scraper.collectDepartment(any(), any())).thenReturn(0);
        when(repository.findLatest()).thenReturn(Optional.empty());
        when(repository.save(any(), eq(NOW))).thenAnswer(inv -> new StoredSnapshot(1L, NOW, inv.getArgument(0)));

        assertThatThrownBy(() -> service.collectOnce()).hasMessage("timeout");

        assertThat(service.collectOnce()).isPresent();
    }
}
