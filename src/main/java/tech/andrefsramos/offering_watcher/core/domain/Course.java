package tech.andrefsramos.offering_watcher.core.domain;

import java.util.List;

/**
 * Oferta de uma disciplina (código + turma) em um período letivo.
 * examDate, examTime e info são opcionais (null quando ausentes).
 */
public record Course(
        String code,
        int group,
        String name,
        String lecturer,
        int capacity,
        int registered,
        int units,
        String examDate,
        String examTime,
        List<CourseSession> sessions,
        String info,
        String department,
        int departmentCode,
        String grade,
        int year,
        int semester
) {

    public Course {
        sessions = (sessions == null) ? List.of() : List.copyOf(sessions);
    }

    public String key() {
        return keyOf(code, group);
    }

    public static String keyOf(String code, int group) {
        return (code == null ? "" : code) + "-" + group;
    }
}
