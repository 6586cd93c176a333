package tech.andrefsramos.offering_watcher.core.domain;

/**
 * Departamento observado no portal. O nome armazenado usa "_" no lugar de espaços.
 */
public record Department(int code, String storedName) {

    public String displayName() {
        return storedName == null ? "" : storedName.replace('_', ' ');
    }
}
