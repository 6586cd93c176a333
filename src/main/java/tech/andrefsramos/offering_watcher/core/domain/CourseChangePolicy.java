package tech.andrefsramos.offering_watcher.core.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class CourseChangePolicy {

    private CourseChangePolicy() {}

    public static boolean isRelevantUpdate(Course oldC, Course newC) {
        if (oldC == null) return true;
        return !changedFields(oldC, newC).isEmpty();
    }

    public static Map<String, FieldChange> changedFields(Course oldC, Course newC) {
        return changedFields(CourseField.valuesOf(oldC), CourseField.valuesOf(newC));
    }

    /**
     * Campos presentes nos dois lados cujo valor difere, na ordem do lado novo.
     * Campos presentes em apenas um dos lados são ignorados.
     */
    public static Map<String, FieldChange> changedFields(Map<String, Object> oldFields, Map<String, Object> newFields) {
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : newFields.entrySet()) {
            String field = e.getKey();
            if (!oldFields.containsKey(field)) continue;
            Object before = oldFields.get(field);
            Object after = e.getValue();
            if (!Objects.equals(before, after)) {
                changes.put(field, new FieldChange(before, after));
            }
        }
        return changes;
    }
}
