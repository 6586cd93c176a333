package tech.andrefsramos.offering_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.application.NotifyChangesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.ports.NotificationPort;
import tech.andrefsramos.offering_watcher.core.report.ChangeReportFormatter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Converte o diff de uma passada em {@link ChangeReport} (um bloco por departamento) e entrega
 * ao {@link NotificationPort}. Diff vazio não gera mensagem nenhuma.
 */
public class NotifyChangesService implements NotifyChangesUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotifyChangesService.class);

    private final NotificationPort notificationPort;

    public NotifyChangesService(NotificationPort notificationPort) {
        this.notificationPort = notificationPort;
    }

    @Override
    public void notifyChanges(Instant from, Instant to, DiffResult diff) {
        final long t0 = System.nanoTime();

        if (diff == null || diff.isEmpty()) {
            log.info("[Notify] Nenhuma mudança entre os snapshots; nenhuma mensagem será enviada.");
            return;
        }

        List<String> blocks = ChangeReportFormatter.format(diff);
        log.info("[Notify] Enviando relatório: departamentos={} added={} removed={} updated={} (de {} até {})",
                blocks.size(), diff.addedCount(), diff.removedCount(), diff.updatedCount(), from, to);

        try {
            notificationPort.notifyChanges(new ChangeReport(from, to, blocks));
        } catch (Exception e) {
            log.error("[Notify] Falha ao entregar relatório (blocos={}): {}", blocks.size(), e.getMessage(), e);
        }

        log.info("[Notify] FIM blocos={} duração={} ms",
                blocks.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
    }
}
