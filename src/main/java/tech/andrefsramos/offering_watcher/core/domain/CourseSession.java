package tech.andrefsramos.offering_watcher.core.domain;

/**
 * Uma ocorrência semanal de aula: dia da semana (0 = sábado ... 6 = sexta) e horários "HH:MM".
 */
public record CourseSession(
        int dayOfWeek,
        String startTime,
        String endTime
) {}
