package tech.andrefsramos.offering_watcher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.offering_watcher.adapters.outbound.notify.CompositeNotificationPort;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.SnapshotJsonCodec;
import tech.andrefsramos.offering_watcher.adapters.outbound.scrapers.DepartmentCatalog;
import tech.andrefsramos.offering_watcher.core.application.*;
import tech.andrefsramos.offering_watcher.core.application.impl.*;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.ports.*;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/*
 * Finalidade

 * Compõe os casos de uso e as portas com dependências explícitas via construtor.
 * Parâmetros vêm de application.yml / variáveis de ambiente; valores numéricos inválidos
 * são ajustados com WARN.

 * Visão Geral dos Beans

 * - DetectChangesUseCase: diff entre dois snapshots, agrupado por departamento.
 * - NotificationPort (Composite): agrega os canais concretos (Telegram, ...).
 * - NotifyChangesUseCase: formata o relatório e entrega ao NotificationPort.
 * - CollectCoursesUseCase: passada completa (login, departamentos, arquivo, diff, notificação).
 * - QuerySnapshotsUseCase: listagem, exportação e diff histórico do arquivo.
 * - SnapshotJsonCodec: forma JSON persistida dos snapshots.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    static final long MIN_DEPARTMENT_DELAY_MS = 0;
    static final long MAX_DEPARTMENT_DELAY_MS = 600_000;

    /* ============================= SnapshotJsonCodec ============================= */

    @Bean
    SnapshotJsonCodec snapshotJsonCodec(ObjectMapper objectMapper) {
        return new SnapshotJsonCodec(objectMapper);
    }

    /* ============================= DetectChangesUseCase ============================= */

    @Bean
    DetectChangesUseCase detectChangesUseCase() {
        final long t0 = System.nanoTime();
        DetectChangesUseCase bean = new DetectChangesService();
        log.info("[AppConfig] DetectChangesUseCase inicializado (tookMs={}ms)", (System.nanoTime() - t0) / 1_000_000);
        return bean;
    }

    /* ============================= NotificationPort (Composite) ============================= */

    @Bean
    public NotificationPort notificationPort(List<NotificationPort> ports) {
        final long t0 = System.nanoTime();
        try {
            List<NotificationPort> delegates = (ports == null) ? List.of() : ports;
            delegates = delegates.stream()
                    .filter(p -> !(p instanceof CompositeNotificationPort))
                    .toList();

            if (delegates.isEmpty()) {
                log.warn("[AppConfig] Nenhum NotificationPort concreto encontrado. Relatórios ficarão apenas no log.");
            } else {
                log.info("[AppConfig] NotificationPorts concretos detectados: count={}", delegates.size());
            }

            NotificationPort bean = new CompositeNotificationPort(delegates);
            log.info("[AppConfig] NotificationPort (Composite) inicializado (adapters={}) tookMs={}ms",
                    delegates.size(), (System.nanoTime() - t0) / 1_000_000);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar NotificationPort composite: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= NotifyChangesUseCase ============================= */

    @Bean
    NotifyChangesUseCase notifyChangesUseCase(NotificationPort notificationPort) {
        Objects.requireNonNull(notificationPort, "notificationPort is required");
        NotifyChangesUseCase bean = new NotifyChangesService(notificationPort);
        log.info("[AppConfig] NotifyChangesUseCase inicializado.");
        return bean;
    }

    /* ============================= CollectCoursesUseCase ============================= */

    @Bean
    CollectCoursesUseCase collectCoursesUseCase(
            ScraperPort scraper,
            DetectChangesUseCase detectChangesUseCase,
            NotifyChangesUseCase notifyChangesUseCase,
            SnapshotRepository snapshotRepository,
            @Value("${app.edu.departments:}") String departmentIds,
            @Value("${app.edu.departmentDelayMs:25000}") long departmentDelayMs
    ) {
        final long t0 = System.nanoTime();
        try {
            List<Department> departments = DepartmentCatalog.select(parseIds(departmentIds));
            long delay = clampDelay(departmentDelayMs);

            CollectCoursesUseCase bean = new CollectCoursesService(
                    scraper,
                    departments,
                    detectChangesUseCase,
                    notifyChangesUseCase,
                    snapshotRepository,
                    delay,
                    Clock.systemUTC()
            );

            log.info("[AppConfig] CollectCoursesUseCase inicializado (departamentos={}, delayMs={}) tookMs={}ms",
                    departments.size(), delay, (System.nanoTime() - t0) / 1_000_000);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar CollectCoursesUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= QuerySnapshotsUseCase ============================= */

    @Bean
    QuerySnapshotsUseCase querySnapshotsUseCase(
            SnapshotRepository snapshotRepository,
            DetectChangesUseCase detectChangesUseCase
    ) {
        QuerySnapshotsUseCase bean = new QuerySnapshotsService(snapshotRepository, detectChangesUseCase);
        log.info("[AppConfig] QuerySnapshotsUseCase inicializado.");
        return bean;
    }

    static List<String> parseIds(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    static long clampDelay(long delayMs) {
        if (delayMs < MIN_DEPARTMENT_DELAY_MS) {
            log.warn("[AppConfig] app.edu.departmentDelayMs={} inválido. Ajustando para {}.", delayMs, MIN_DEPARTMENT_DELAY_MS);
            return MIN_DEPARTMENT_DELAY_MS;
        }
        if (delayMs > MAX_DEPARTMENT_DELAY_MS) {
            log.warn("[AppConfig] app.edu.departmentDelayMs={} acima do máximo. Ajustando para {}.", delayMs, MAX_DEPARTMENT_DELAY_MS);
            return MAX_DEPARTMENT_DELAY_MS;
        }
        return delayMs;
    }
}
