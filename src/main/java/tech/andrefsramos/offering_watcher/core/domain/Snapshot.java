package tech.andrefsramos.offering_watcher.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/*
 * Finalidade

 * Estado completo observado em uma passada de coleta: chave "código-turma" -> Course.
 * É criado vazio pelo chamador, preenchido departamento a departamento e depois entregue
 * ao DetectChanges ou ao arquivo. Não há instância global: quem cria é o dono.

 * Regras
 * - Chave repetida na mesma passada sobrescreve a anterior (última escrita vence).
 * - Não é thread-safe; as passadas por departamento são serializadas pelo chamador.
 */
public final class Snapshot {

    private final Map<String, Course> courses = new LinkedHashMap<>();

    public Snapshot() {}

    public Snapshot(Map<String, Course> initial) {
        if (initial != null) courses.putAll(initial);
    }

    public static Snapshot of(Course... items) {
        Snapshot s = new Snapshot();
        for (Course c : items) s.put(c);
        return s;
    }

    /** Insere pelo {@link Course#key()}; devolve o registro substituído, se houver. */
    public Optional<Course> put(Course course) {
        return Optional.ofNullable(courses.put(course.key(), course));
    }

    public Optional<Course> get(String key) {
        return Optional.ofNullable(courses.get(key));
    }

    public boolean contains(String key) {
        return courses.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(courses.keySet());
    }

    public Map<String, Course> asMap() {
        return Collections.unmodifiableMap(courses);
    }

    public int size() {
        return courses.size();
    }

    public boolean isEmpty() {
        return courses.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        return courses.equals(other.courses);
    }

    @Override
    public int hashCode() {
        return courses.hashCode();
    }

    @Override
    public String toString() {
        return "Snapshot{size=" + courses.size() + "}";
    }
}
