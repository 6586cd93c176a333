package tech.andrefsramos.offering_watcher.core.parsing;

import tech.andrefsramos.offering_watcher.core.domain.CourseSession;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Caminho inverso do {@link ScheduleTextParser#parseWeeklySchedule(String)}, usado só no relatório.
 * A forma compacta ("شنبه و دوشنبه از 09:00 تا 10:30") só é usada quando TODAS as sessões
 * têm o mesmo início e fim; caso contrário cada sessão sai separada por "، ".
 */
public final class WeeklyScheduleFormatter {

    public static final String UNDEFINED = "تعریف نشده";
    static final String DAY_JOINER = " و ";
    static final String SESSION_SEPARATOR = "، ";

    private WeeklyScheduleFormatter() {}

    public static String format(List<CourseSession> sessions) {
        if (sessions == null || sessions.isEmpty()) return UNDEFINED;

        CourseSession first = sessions.get(0);
        boolean uniform = sessions.stream().allMatch(s ->
                Objects.equals(s.startTime(), first.startTime()) && Objects.equals(s.endTime(), first.endTime()));

        if (uniform) {
            String days = sessions.stream()
                    .map(s -> dayName(s.dayOfWeek()))
                    .collect(Collectors.joining(DAY_JOINER));
            return days + range(first);
        }

        return sessions.stream()
                .map(s -> dayName(s.dayOfWeek()) + range(s))
                .collect(Collectors.joining(SESSION_SEPARATOR));
    }

    private static String range(CourseSession s) {
        return " از " + s.startTime() + " تا " + s.endTime();
    }

    private static String dayName(int index) {
        return Weekday.fromIndex(index).map(Weekday::displayName).orElse(String.valueOf(index));
    }
}
