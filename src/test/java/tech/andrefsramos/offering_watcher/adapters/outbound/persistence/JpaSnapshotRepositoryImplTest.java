package tech.andrefsramos.offering_watcher.adapters.outbound.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity.SnapshotEntity;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static tech.andrefsramos.offering_watcher.core.domain.CourseFixtures.course;

class JpaSnapshotRepositoryImplTest {

    private static final Instant TAKEN_AT = Instant.parse("2025-01-20T10:00:00Z");

    private final EntityManager em = mock(EntityManager.class);
    private final SnapshotJsonCodec codec = new SnapshotJsonCodec(new ObjectMapper());
    private JpaSnapshotRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new JpaSnapshotRepositoryImpl(codec);
        ReflectionTestUtils.setField(repository, "em", em);
    }

    @Test
    void savePersistsJsonAndCount() {
        doAnswer(inv -> {
            inv.<SnapshotEntity>getArgument(0).setId(42L);
            return null;
        }).when(em).persist(any(SnapshotEntity.class));
        Snapshot s = Snapshot.of(course("101", 1, "X", 30, "CS"));

        StoredSnapshot stored = repository.save(s, TAKEN_AT);

        assertThat(stored.id()).isEqualTo(42L);
        assertThat(stored.takenAt()).isEqualTo(TAKEN_AT);
        verify(em).persist(argThat((SnapshotEntity e) ->
                e.getCourseCount() == 1 && e.getTakenAt().equals(TAKEN_AT) && e.getRawJson().contains("\"101-1\"")));
        verify(em).flush();
    }

    @Test
    @SuppressWarnings("unchecked")
    void findLatestDecodesStoredJson() {
        SnapshotEntity row = new SnapshotEntity();
        row.setId(7L);
        row.setTakenAt(TAKEN_AT);
        Snapshot s = Snapshot.of(course("101", 1, "X", 30, "CS"));
        row.setRawJson(codec.encode(s));
        row.setCourseCount(1);

        TypedQuery<SnapshotEntity> query = mock(TypedQuery.class);
        when(em.createQuery(anyString(), eq(SnapshotEntity.class))).thenReturn(query);
        when(query.setMaxResults(1)).thenReturn(query);
        when(query.getResultList()).thenReturn(List.of(row));

        StoredSnapshot latest = repository.findLatest().orElseThrow();

        assertThat(latest.id()).isEqualTo(7L);
        assertThat(latest.snapshot()).isEqualTo(s);
    }

    @Test
    void missingRowsAreEmpty() {
        when(em.find(SnapshotEntity.class, 9L)).thenReturn(null);

        assertThat(repository.findById(9L)).isEmpty();
        assertThat(repository.findRawJsonById(9L)).isEmpty();
    }
}
