package tech.andrefsramos.offering_watcher.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Relatório pronto para entrega: instantes dos dois snapshots comparados e um bloco de texto por departamento.
 * {@code from} é null quando o snapshot anterior não tem data conhecida.
 */
public record ChangeReport(Instant from, Instant to, List<String> blocks) {

    public ChangeReport {
        blocks = (blocks == null) ? List.of() : List.copyOf(blocks);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
