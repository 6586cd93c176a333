package tech.andrefsramos.offering_watcher.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.application.DetectChangesUseCase;
import tech.andrefsramos.offering_watcher.core.application.QuerySnapshotsUseCase;
import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.domain.DiffResult;
import tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;
import tech.andrefsramos.offering_watcher.core.ports.SnapshotRepository;
import tech.andrefsramos.offering_watcher.core.report.ChangeReportFormatter;

import java.util.List;
import java.util.Optional;

/*
 * Finalidade

 * Leitura do arquivo de snapshots: listagem recente, exportação na forma JSON persistida
 * e comparação entre quaisquer dois snapshots arquivados (não só o imediatamente anterior).
 */
public class QuerySnapshotsService implements QuerySnapshotsUseCase {

    private static final Logger log = LoggerFactory.getLogger(QuerySnapshotsService.class);

    private final SnapshotRepository snapshotRepository;
    private final DetectChangesUseCase detectChanges;

    public QuerySnapshotsService(SnapshotRepository snapshotRepository, DetectChangesUseCase detectChanges) {
        this.snapshotRepository = snapshotRepository;
        this.detectChanges = detectChanges;
    }

    @Override
    public List<SnapshotSummary> listRecent(int limit) {
        return snapshotRepository.listRecent(limit);
    }

    @Override
    public Optional<String> rawJson(long id) {
        return snapshotRepository.findRawJsonById(id);
    }

    @Override
    public Optional<ChangeReport> compare(long fromId, long toId) {
        Optional<StoredSnapshot> from = snapshotRepository.findById(fromId);
        Optional<StoredSnapshot> to = snapshotRepository.findById(toId);
        if (from.isEmpty() || to.isEmpty()) {
            log.warn("[Query] Snapshot inexistente para comparação from={} (achado={}) to={} (achado={})",
                    fromId, from.isPresent(), toId, to.isPresent());
            return Optional.empty();
        }

        DiffResult diff = detectChanges.diff(from.get().snapshot(), to.get().snapshot());
        List<String> blocks = ChangeReportFormatter.format(diff);
        log.info("[Query] Comparação from={} to={} -> blocos={}", fromId, toId, blocks.size());
        return Optional.of(new ChangeReport(from.get().takenAt(), to.get().takenAt(), blocks));
    }
}
