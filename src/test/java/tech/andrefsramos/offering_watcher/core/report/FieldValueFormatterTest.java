package tech.andrefsramos.offering_watcher.core.report;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.offering_watcher.core.domain.CourseSession;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValueFormatterTest {

    @Test
    void sessionsAreRenderedAsWeeklySchedule() {
        String text = FieldValueFormatter.format("Sessions", List.of(
                new CourseSession(0, "09:00", "10:30"),
                new CourseSession(2, "09:00", "10:30")));

        assertThat(text).isEqualTo("شنبه و دوشنبه از 09:00 تا 10:30");
    }

    @Test
    void emptySessionsAreUndefined() {
        assertThat(FieldValueFormatter.format("Sessions", List.of())).isEqualTo("تعریف نشده");
    }

    @Test
    void sessionsValueThatIsNotSessionListFallsBackToPlainText() {
        assertThat(FieldValueFormatter.format("Sessions", List.of("x", "y"))).isEqualTo("[x, y]");
        assertThat(FieldValueFormatter.format("Sessions", "شنبه")).isEqualTo("شنبه");
    }

    @Test
    void otherFieldsArePlainText() {
        assertThat(FieldValueFormatter.format("Registered", 32)).isEqualTo("32");
        assertThat(FieldValueFormatter.format("Lecturer", "Dr. A")).isEqualTo("Dr. A");
        assertThat(FieldValueFormatter.format("Unmapped", "v")).isEqualTo("v");
    }

    @Test
    void nullOrEmptyIsUndefined() {
        assertThat(FieldValueFormatter.format("Info", null)).isEqualTo("تعریف نشده");
        assertThat(FieldValueFormatter.format("ExamDate", "")).isEqualTo("تعریف نشده");
    }
}
