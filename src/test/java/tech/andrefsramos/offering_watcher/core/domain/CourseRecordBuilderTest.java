package tech.andrefsramos.offering_watcher.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CourseRecordBuilderTest {

    private final Department computer = new Department(40, "مهندسی_کامپیوتر");

    @Test
    void mapsFixedColumnPositions() {
        CourseRecordBuilder builder = new CourseRecordBuilder(computer, new Term(1404, 1), Grade.BS);

        Course c = builder.fromCells(List.of("12345", "1", "3", "Algorithms", "", "40", "38", "Dr. A",
                "1403/10/12 14:00", "شنبه از 08:00 تا 09:30", "", "notes"));

        assertThat(c.code()).isEqualTo("12345");
        assertThat(c.group()).isEqualTo(1);
        assertThat(c.units()).isEqualTo(3);
        assertThat(c.name()).isEqualTo("Algorithms");
        assertThat(c.capacity()).isEqualTo(40);
        assertThat(c.registered()).isEqualTo(38);
        assertThat(c.lecturer()).isEqualTo("Dr. A");
        assertThat(c.examDate()).isEqualTo("1403/10/12");
        assertThat(c.examTime()).isEqualTo("14:00");
        assertThat(c.sessions()).containsExactly(new CourseSession(0, "08:00", "09:30"));
        assertThat(c.info()).isEqualTo("notes");
        assertThat(c.grade()).isEqualTo("bs");
        assertThat(c.year()).isEqualTo(1404);
        assertThat(c.semester()).isEqualTo(1);
        assertThat(c.key()).isEqualTo("12345-1");
    }

    @Test
    void stampsHumanizedDepartmentName() {
        Course c = new CourseRecordBuilder(computer, Term.UNKNOWN, Grade.MS)
                .fromCells(List.of("40101", "2", "3", "Compilers"));

        assertThat(c.department()).isEqualTo("مهندسی کامپیوتر");
        assertThat(c.departmentCode()).isEqualTo(40);
        assertThat(c.grade()).isEqualTo("ms");
    }

    @Test
    void invalidNumbersKeepZeroAndRowStillBuilds() {
        Course c = new CourseRecordBuilder(computer, Term.UNKNOWN, Grade.BS)
                .fromCells(List.of("40101", "x", "?", "Compilers", "", "--", "", "Dr. B", "", "", "", "   "));

        assertThat(c.group()).isZero();
        assertThat(c.units()).isZero();
        assertThat(c.capacity()).isZero();
        assertThat(c.registered()).isZero();
        assertThat(c.examDate()).isNull();
        assertThat(c.examTime()).isNull();
        assertThat(c.sessions()).isEmpty();
        assertThat(c.info()).isNull();
    }

    @Test
    void shortRowsFallBackToDefaults() {
        Course c = new CourseRecordBuilder(computer, new Term(1404, 2), Grade.PHD)
                .fromCells(List.of("40999"));

        assertThat(c.code()).isEqualTo("40999");
        assertThat(c.name()).isEmpty();
        assertThat(c.lecturer()).isEmpty();
        assertThat(c.sessions()).isEmpty();
        assertThat(c.semester()).isEqualTo(2);
        assertThat(c.grade()).isEqualTo("phd");
    }
}
