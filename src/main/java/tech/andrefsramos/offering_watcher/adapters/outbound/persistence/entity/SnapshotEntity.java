package tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@ToString(exclude = "rawJson")
@Entity
@Table(name = "offering_snapshot", indexes = {
        @Index(name = "idx_offering_snapshot_taken_at", columnList = "taken_at")
})
public class SnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "taken_at", nullable = false)
    private Instant takenAt;

    @Column(name = "course_count", nullable = false)
    private int courseCount;

    @Lob
    @Column(name = "raw_json", nullable = false)
    private String rawJson;
}
