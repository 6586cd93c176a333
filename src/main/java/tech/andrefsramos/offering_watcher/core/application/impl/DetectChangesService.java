package tech.andrefsramos.offering_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.application.DetectChangesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseChangePolicy;
import tech.andrefsramos.offering_watcher.core.domain.CourseField;
import tech.andrefsramos.offering_watcher.core.domain.CourseUpdate;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.FieldChange;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Compara dois snapshots completos ("anterior" e "atual") e produz o {@link DiffResult}:
 *  1) added/removed: diferença de conjuntos sobre as chaves.
 *  2) Para as chaves comuns, compara a forma serializada ({@link CourseField#valuesOf(Course)}).
 *     Se diferir, calcula o changeset campo a campo via {@link CourseChangePolicy}.
 *  3) Changeset vazio não entra em "updated".

 * Nenhum dos snapshots é alterado; o serviço pode ser chamado quantas vezes for preciso,
 * inclusive contra snapshots arquivados antigos.
 */
public class DetectChangesService implements DetectChangesUseCase {

    private static final Logger log = LoggerFactory.getLogger(DetectChangesService.class);
    static final String UNKNOWN_DEPARTMENT = "Unknown";

    @Override
    public DiffResult diff(Snapshot previous, Snapshot current) {
        final long t0 = System.nanoTime();
        final Snapshot before = previous != null ? previous : new Snapshot();
        final Snapshot after = current != null ? current : new Snapshot();

        final Map<String, Map<String, Course>> added = new HashMap<>();
        final Map<String, Map<String, Course>> removed = new HashMap<>();
        final Map<String, Map<String, CourseUpdate>> updated = new HashMap<>();
        int unchanged = 0;

        for (Map.Entry<String, Course> e : after.asMap().entrySet()) {
            if (!before.contains(e.getKey())) {
                added.computeIfAbsent(departmentOf(e.getValue()), d -> new HashMap<>()).put(e.getKey(), e.getValue());
            }
        }

        for (Map.Entry<String, Course> e : before.asMap().entrySet()) {
            String key = e.getKey();
            Course old = e.getValue();
            Course now = after.asMap().get(key);

            if (now == null) {
                removed.computeIfAbsent(departmentOf(old), d -> new HashMap<>()).put(key, old);
                continue;
            }

            Map<String, Object> oldFields = CourseField.valuesOf(old);
            Map<String, Object> newFields = CourseField.valuesOf(now);
            if (oldFields.equals(newFields)) {
                unchanged++;
                continue;
            }

            warnOnFieldDrift(key, oldFields, newFields);
            Map<String, FieldChange> changes = CourseChangePolicy.changedFields(oldFields, newFields);
            if (changes.isEmpty()) {
                if (log.isDebugEnabled()) {
                    log.debug("[Detect] key={} difere apenas em campos não comparáveis; ignorado.", key);
                }
                unchanged++;
                continue;
            }

            updated.computeIfAbsent(departmentOf(now), d -> new HashMap<>())
                    .put(key, new CourseUpdate(now.name(), changes));
        }

        DiffResult result = new DiffResult(added, removed, updated);
        log.info("[Detect] Concluído: anterior={}, atual={}, added={}, removed={}, updated={}, unchanged={}, duração={} ms",
                before.size(), after.size(), result.addedCount(), result.removedCount(), result.updatedCount(),
                unchanged, durMs(t0, System.nanoTime()));
        return result;
    }

    private static void warnOnFieldDrift(String key, Map<String, Object> oldFields, Map<String, Object> newFields) {
        if (oldFields.keySet().equals(newFields.keySet())) return;
        Set<String> onlyOld = new HashSet<>(oldFields.keySet());
        onlyOld.removeAll(newFields.keySet());
        Set<String> onlyNew = new HashSet<>(newFields.keySet());
        onlyNew.removeAll(oldFields.keySet());
        log.warn("[Detect] Campos divergentes entre passadas para key={} (somenteAnterior={}, somenteAtual={}); ignorados no changeset.",
                key, onlyOld, onlyNew);
    }

    private static String departmentOf(Course c) {
        String d = c.department();
        return (d == null) ? UNKNOWN_DEPARTMENT : d;
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
