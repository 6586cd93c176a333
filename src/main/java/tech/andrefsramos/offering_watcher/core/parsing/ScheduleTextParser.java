package tech.andrefsramos.offering_watcher.core.parsing;

import tech.andrefsramos.offering_watcher.core.domain.CourseSession;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Conversores puros de texto do portal para valores normalizados:
 *  - normalizeTime: "H:M" -> "HH:MM";
 *  - splitExam: "1403/10/12 14:00" -> (data, hora);
 *  - parseWeeklySchedule: "شنبه و دوشنبه از 9:0 تا 10:30" -> sessões semanais.

 * Nenhum método lança exceção por formato inválido: o resultado degrada para vazio/null.
 */
public final class ScheduleTextParser {

    private static final Pattern EXAM = Pattern.compile(
            "(?<date>\\S+)\\s*(?<time>\\d{2}:\\d{2})", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern SEGMENT = Pattern.compile(
            "(?<days>[^\\d]+) از (?<start>\\d{1,2}:\\d{1,2}) تا (?<end>\\d{1,2}:\\d{1,2})",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final String DAY_JOINER = " و ";

    private ScheduleTextParser() {}

    /**
     * Completa a hora com zero à esquerda e o minuto com zero à DIREITA ("9:5" -> "09:50").
     * É o comportamento observado no portal; não trocar por zero à esquerda.
     */
    public static String normalizeTime(String raw) {
        if (raw == null) return null;
        String[] parts = raw.split(":", -1);
        if (parts.length != 2) return raw;
        String h = parts[0];
        String m = parts[1];
        if (h.length() == 1) h = "0" + h;
        if (m.length() == 1) m = m + "0";
        return h + ":" + m;
    }

    public static ExamSlot splitExam(String text) {
        if (text == null) return ExamSlot.NONE;
        Matcher m = EXAM.matcher(text);
        if (!m.find()) return ExamSlot.NONE;
        return new ExamSlot(trimToNull(m.group("date")), trimToNull(m.group("time")));
    }

    public static List<CourseSession> parseWeeklySchedule(String text) {
        List<CourseSession> sessions = new ArrayList<>();
        if (text == null || text.isBlank()) return sessions;

        Matcher m = SEGMENT.matcher(text);
        while (m.find()) {
            String start = normalizeTime(m.group("start"));
            String end = normalizeTime(m.group("end"));
            for (String rawDay : m.group("days").split(DAY_JOINER)) {
                Optional<Weekday> day = Weekday.fromPortalName(rawDay.strip());
                day.ifPresent(d -> sessions.add(new CourseSession(d.index(), start, end)));
            }
        }
        return sessions;
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }
}
