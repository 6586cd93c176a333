package tech.andrefsramos.offering_watcher.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registro presente nos dois snapshots com pelo menos um campo alterado.
 * {@code changes} usa o nome JSON do campo como chave e preserva a ordem da tabela de campos.
 */
public record CourseUpdate(String name, Map<String, FieldChange> changes) {

    public CourseUpdate {
        changes = (changes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }
}
