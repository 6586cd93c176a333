package tech.andrefsramos.offering_watcher.core.report;

import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseField;
import tech.andrefsramos.offering_watcher.core.domain.CourseUpdate;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.FieldChange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/*
 * Finalidade

 * Transforma um {@link DiffResult} em blocos de texto, um por departamento com mudanças.

 * Formato de cada bloco
 *  🏛️ <departamento>:
 *  🟢 Added Courses:      (somente se houver)
 *  - <nome> (ID: <chave>)
 *  🔴 Removed Courses:    (somente se houver)
 *  🟡 Updated Courses:    (somente se houver)
 *  - <nome> (ID: <chave>)
 *      <rótulo>: <antigo> ◀️ <novo>

 * Departamentos em ordem lexicográfica. Cada entrada termina com uma linha em branco.
 * Nenhuma informação depende de espaço à esquerda, então o bloco pode ser quebrado por linha.
 */
public final class ChangeReportFormatter {

    static final String ADDED_TITLE = "🟢 Added Courses:";
    static final String REMOVED_TITLE = "🔴 Removed Courses:";
    static final String UPDATED_TITLE = "🟡 Updated Courses:";
    static final String ARROW = " ◀️ ";
    private static final String UNNAMED = "Unnamed";

    private ChangeReportFormatter() {}

    public static List<String> format(DiffResult diff) {
        List<String> blocks = new ArrayList<>();
        if (diff == null) return blocks;

        for (String dept : diff.departments()) {
            List<String> lines = new ArrayList<>();
            lines.add("🏛️ " + dept + ":");

            Map<String, Course> added = diff.added().getOrDefault(dept, Map.of());
            if (!added.isEmpty()) {
                lines.add(ADDED_TITLE);
                added.forEach((key, c) -> {
                    lines.add(entryLine(c.name(), key));
                    lines.add("");
                });
            }

            Map<String, Course> removed = diff.removed().getOrDefault(dept, Map.of());
            if (!removed.isEmpty()) {
                lines.add(REMOVED_TITLE);
                removed.forEach((key, c) -> {
                    lines.add(entryLine(c.name(), key));
                    lines.add("");
                });
            }

            Map<String, CourseUpdate> updated = diff.updated().getOrDefault(dept, Map.of());
            if (!updated.isEmpty()) {
                lines.add(UPDATED_TITLE);
                updated.forEach((key, u) -> {
                    lines.add(entryLine(u.name(), key));
                    u.changes().forEach((field, change) -> lines.add(changeLine(field, change)));
                    lines.add("");
                });
            }

            blocks.add(String.join("\n", lines));
        }
        return blocks;
    }

    static String changeLine(String field, FieldChange change) {
        return "    " + CourseField.labelOf(field) + ": "
                + FieldValueFormatter.format(field, change.oldValue())
                + ARROW
                + FieldValueFormatter.format(field, change.newValue());
    }

    private static String entryLine(String name, String key) {
        String n = (name == null) ? UNNAMED : name;
        return "- " + n + " (ID: " + key + ")";
    }
}
