package tech.andrefsramos.offering_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.application.CollectCoursesUseCase;
import tech.andrefsramos.offering_watcher.core.application.DetectChangesUseCase;
import tech.andrefsramos.offering_watcher.core.application.NotifyChangesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;
import tech.andrefsramos.offering_watcher.core.ports.ScraperPort;
import tech.andrefsramos.offering_watcher.core.ports.SnapshotRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/*
 * Finalidade

 * Orquestra uma passada completa de coleta:
 *  1) Abre a sessão no portal ({@link ScraperPort#openSession()}).
 *  2) Para cada departamento observado, busca a página e extrai as ofertas para um Snapshot novo,
 *     com pausa entre departamentos para não sobrecarregar o portal.
 *  3) Carrega o último snapshot arquivado, arquiva o novo e calcula o diff.
 *  4) Delega a notificação a {@link NotifyChangesUseCase}.

 * Regras
 * - A passada é tudo-ou-nada: qualquer falha de sessão/transporte aborta sem arquivar nem notificar,
 *   e a exceção é propagada ao chamador.
 * - Na primeira passada (sem snapshot anterior) apenas arquiva.
 * - Passadas não se sobrepõem; uma chamada concorrente retorna vazio.
 */
public class CollectCoursesService implements CollectCoursesUseCase {

    private static final Logger log = LoggerFactory.getLogger(CollectCoursesService.class);

    private final ScraperPort scraper;
    private final List<Department> departments;
    private final DetectChangesUseCase detectChanges;
    private final NotifyChangesUseCase notifyChanges;
    private final SnapshotRepository snapshotRepository;
    private final long departmentDelayMs;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CollectCoursesService(
            ScraperPort scraper,
            List<Department> departments,
            DetectChangesUseCase detectChanges,
            NotifyChangesUseCase notifyChanges,
            SnapshotRepository snapshotRepository,
            long departmentDelayMs,
            Clock clock
    ) {
        this.scraper = scraper;
        this.departments = departments != null ? List.copyOf(departments) : List.of();
        this.detectChanges = detectChanges;
        this.notifyChanges = notifyChanges;
        this.snapshotRepository = snapshotRepository;
        this.departmentDelayMs = Math.max(0, departmentDelayMs);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public Optional<CollectionOutcome> collectOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[Collect] Passada anterior ainda em execução; chamada ignorada.");
            return Optional.empty();
        }
        try {
            return Optional.of(runPass());
        } finally {
            running.set(false);
        }
    }

    private CollectionOutcome runPass() {
        final long t0 = System.nanoTime();

        if (departments.isEmpty()) {
            log.warn("[Collect] Nenhum departamento configurado (app.edu.departments). Passada sem conteúdo.");
        }
        log.info("[Collect] Iniciando passada departamentos={} delayEntreDepartamentos={} ms",
                departments.size(), departmentDelayMs);

        try {
            scraper.openSession();
        } catch (RuntimeException e) {
            log.error("[Collect] Falha ao abrir sessão no portal: {}", e.getMessage(), e);
            throw e;
        }
        log.info("[Collect] Sessão aberta ({} ms)", durMs(t0, System.nanoTime()));

        final Snapshot current = new Snapshot();
        for (int i = 0; i < departments.size(); i++) {
            Department dept = departments.get(i);
            final long ti = System.nanoTime();
            int got;
            try {
                got = scraper.collectDepartment(dept, current);
            } catch (RuntimeException e) {
                log.error("[Collect] Falha ao coletar departamento={} ({}). Passada abortada. Causa={}",
                        dept.code(), dept.displayName(), e.getMessage(), e);
                throw e;
            }
            log.info("[Collect] Departamento={} coletado: cursos={} totalAcumulado={} ({} ms)",
                    dept.code(), got, current.size(), durMs(ti, System.nanoTime()));

            if (i < departments.size() - 1) {
                pause();
            }
        }
        log.info("[Collect] Extração concluída: cursos={} departamentos={}", current.size(), departments.size());

        final Optional<StoredSnapshot> previous = snapshotRepository.findLatest();
        final Instant takenAt = clock.instant();
        final StoredSnapshot saved = snapshotRepository.save(current, takenAt);
        log.info("[Collect] Snapshot arquivado id={} cursos={}", saved.id(), current.size());

        DiffResult diff = DiffResult.EMPTY;
        if (previous.isEmpty()) {
            log.info("[Collect] Nenhum snapshot anterior; primeira passada apenas arquiva.");
        } else {
            diff = detectChanges.diff(previous.get().snapshot(), current);
            if (diff.isEmpty()) {
                log.info("[Collect] Nenhuma novidade desde snapshot id={}.", previous.get().id());
            } else {
                notifyChanges.notifyChanges(previous.get().takenAt(), takenAt, diff);
            }
        }

        log.info("[Collect] FIM passada snapshotId={} ({} ms totais)", saved.id(), durMs(t0, System.nanoTime()));
        return new CollectionOutcome(
                saved.id(),
                previous.map(StoredSnapshot::id).orElse(null),
                takenAt,
                departments.size(),
                current.size(),
                diff
        );
    }

    private void pause() {
        if (departmentDelayMs <= 0) return;
        try {
            Thread.sleep(departmentDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("[Collect] Interrompido durante pausa entre departamentos; passada abortada.");
            throw new IllegalStateException("Coleta interrompida", ie);
        }
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
