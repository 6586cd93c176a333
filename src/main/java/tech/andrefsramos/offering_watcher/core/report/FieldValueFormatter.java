package tech.andrefsramos.offering_watcher.core.report;

import tech.andrefsramos.offering_watcher.core.domain.CourseField;
import tech.andrefsramos.offering_watcher.core.domain.CourseSession;
import tech.andrefsramos.offering_watcher.core.parsing.WeeklyScheduleFormatter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Formatação de valores de campo para o relatório: tabela fechada campo -> formatador,
 * com formatador padrão (texto simples, "تعریف نشده" para null/vazio) para os demais.
 */
public final class FieldValueFormatter {

    private static final Map<CourseField, Function<Object, String>> FORMATTERS = new EnumMap<>(CourseField.class);

    static {
        FORMATTERS.put(CourseField.SESSIONS, FieldValueFormatter::formatSessions);
    }

    private FieldValueFormatter() {}

    public static String format(String fieldName, Object value) {
        return CourseField.byJsonName(fieldName)
                .map(FORMATTERS::get)
                .orElse(FieldValueFormatter::plain)
                .apply(value);
    }

    static String plain(Object value) {
        if (value == null) return WeeklyScheduleFormatter.UNDEFINED;
        String s = String.valueOf(value);
        return s.isEmpty() ? WeeklyScheduleFormatter.UNDEFINED : s;
    }

    private static String formatSessions(Object value) {
        if (!(value instanceof List<?> list)) return plain(value);
        if (!list.stream().allMatch(CourseSession.class::isInstance)) return plain(value);
        return WeeklyScheduleFormatter.format(list.stream().map(CourseSession.class::cast).toList());
    }
}
