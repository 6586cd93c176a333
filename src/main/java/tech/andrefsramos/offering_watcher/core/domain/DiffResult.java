package tech.andrefsramos.offering_watcher.core.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/*
 * Finalidade

 * Resultado da comparação entre dois snapshots, agrupado por departamento e depois por chave:
 *  - added:   chaves presentes apenas no novo (departamento do lado novo);
 *  - removed: chaves presentes apenas no antigo (departamento do lado antigo);
 *  - updated: chaves presentes nos dois com campos alterados.

 * Os mapas são ordenados (departamento, chave) para que o conteúdo seja determinístico.
 */
public record DiffResult(
        Map<String, Map<String, Course>> added,
        Map<String, Map<String, Course>> removed,
        Map<String, Map<String, CourseUpdate>> updated
) {

    public static final DiffResult EMPTY = new DiffResult(Map.of(), Map.of(), Map.of());

    public DiffResult {
        added = freeze(added);
        removed = freeze(removed);
        updated = freeze(updated);
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && updated.isEmpty();
    }

    /** União dos departamentos com alguma mudança, em ordem lexicográfica. */
    public Set<String> departments() {
        Set<String> all = new TreeSet<>();
        all.addAll(added.keySet());
        all.addAll(removed.keySet());
        all.addAll(updated.keySet());
        return Collections.unmodifiableSet(all);
    }

    public int addedCount() {
        return added.values().stream().mapToInt(Map::size).sum();
    }

    public int removedCount() {
        return removed.values().stream().mapToInt(Map::size).sum();
    }

    public int updatedCount() {
        return updated.values().stream().mapToInt(Map::size).sum();
    }

    private static <V> Map<String, Map<String, V>> freeze(Map<String, Map<String, V>> in) {
        if (in == null || in.isEmpty()) return Map.of();
        SortedMap<String, Map<String, V>> out = new TreeMap<>();
        in.forEach((dept, byKey) -> {
            if (byKey != null && !byKey.isEmpty()) {
                out.put(dept, Collections.unmodifiableSortedMap(new TreeMap<>(byKey)));
            }
        });
        return Collections.unmodifiableSortedMap(out);
    }
}
