package tech.andrefsramos.offering_watcher.adapters.inbound.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.offering_watcher.core.application.CollectCoursesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;

import java.util.Optional;

/**
 * CollectScheduler

 * Dispara periodicamente uma passada de coleta ({@link CollectCoursesUseCase#collectOnce()}).
 * O intervalo vem de {@code app.collect.fixedDelay} (ISO-8601, padrão PT30M) e é contado a partir
 * do fim da passada anterior. Falhas são registradas e a próxima execução segue normalmente.
 */
@Component
public class CollectScheduler {

    private static final Logger log = LoggerFactory.getLogger(CollectScheduler.class);
    private final CollectCoursesUseCase collect;

    public CollectScheduler(CollectCoursesUseCase collect) {this.collect = collect;}

    @Scheduled(
            initialDelayString = "${app.collect.initialDelay:PT10S}",
            fixedDelayString = "${app.collect.fixedDelay:PT30M}"
    )
    public void run() {
        long start = System.nanoTime();
        log.info("CollectScheduler: início da execução automática de coleta.");

        try {
            Optional<CollectionOutcome> outcome = collect.collectOnce();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (outcome.isEmpty()) {
                log.info("CollectScheduler: passada ignorada, outra execução em andamento (elapsedMs={} ms).", elapsedMs);
                return;
            }
            CollectionOutcome o = outcome.get();
            log.info("CollectScheduler: execução concluída (snapshotId={}, cursos={}, adicionados={}, removidos={}, alterados={}, elapsedMs={} ms).",
                    o.snapshotId(), o.courses(), o.diff().addedCount(), o.diff().removedCount(),
                    o.diff().updatedCount(), elapsedMs);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("CollectScheduler: erro durante a execução automática (elapsedMs={} ms).", elapsedMs, ex);
        }
    }
}
