package tech.andrefsramos.offering_watcher.core.domain;

/**
 * Período letivo lido do cabeçalho da página (ano final do intervalo acadêmico e número do semestre).
 * Semestre 3 representa qualquer rótulo não reconhecido; 0/0 indica cabeçalho ausente.
 */
public record Term(int year, int semester) {

    public static final Term UNKNOWN = new Term(0, 0);
}
