package tech.andrefsramos.offering_watcher.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity.SnapshotEntity;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary;
import tech.andrefsramos.offering_watcher.core.domain.StoredSnapshot;
import tech.andrefsramos.offering_watcher.core.ports.SnapshotRepository;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/*
 * Finalidade

 * Arquivo de snapshots em banco (tabela offering_snapshot). Cada passada bem-sucedida vira uma
 * linha com o instante da coleta, a quantidade de registros e a forma JSON completa (raw_json).

 * Como funciona

 * - save(snapshot, takenAt): serializa via {@link SnapshotJsonCodec}, persiste e devolve o id gerado.
 * - findLatest()/findById(): carregam a linha e desserializam o JSON de volta em Snapshot.
 * - findRawJsonById(): devolve o JSON persistido sem desserializar (exportação).
 * - listRecent(limit): resumo (id, instante, quantidade) do mais recente para o mais antigo.

 * Falhas ao gravar são registradas com contexto e propagadas: quem chama decide abortar a passada.
 */
@Repository
public class JpaSnapshotRepositoryImpl implements SnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaSnapshotRepositoryImpl.class);

    private static final int RAWJSON_WARN_BYTES = 20_000_000;

    @PersistenceContext
    private EntityManager em;

    private final SnapshotJsonCodec codec;

    public JpaSnapshotRepositoryImpl(SnapshotJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    @Transactional
    public StoredSnapshot save(Snapshot snapshot, Instant takenAt) {
        final long t0 = System.nanoTime();
        final String raw = codec.encode(snapshot);
        final int byteLen = raw.getBytes(StandardCharsets.UTF_8).length;

        if (byteLen > RAWJSON_WARN_BYTES) {
            log.warn("[Snapshot] rawJson muito grande (bytes={}). Verifique definição da coluna (TEXT/CLOB).", byteLen);
        }

        try {
            SnapshotEntity e = new SnapshotEntity();
            e.setTakenAt(takenAt);
            e.setCourseCount(snapshot.size());
            e.setRawJson(raw);

            em.persist(e);
            em.flush();

            log.info("[Snapshot] Arquivado. id={} courses={} bytes={} tookMs={}",
                    e.getId(), snapshot.size(), byteLen, (System.nanoTime() - t0) / 1_000_000);
            return new StoredSnapshot(e.getId(), takenAt, snapshot);

        } catch (RuntimeException ex) {
            log.error("[Snapshot] Falha ao persistir snapshot. courses={} bytes={} tookMs={} cause={}",
                    snapshot.size(), byteLen, (System.nanoTime() - t0) / 1_000_000, ex.getMessage(), ex);
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredSnapshot> findLatest() {
        List<SnapshotEntity> rows = em.createQuery(
                        "select s from SnapshotEntity s order by s.takenAt desc, s.id desc", SnapshotEntity.class)
                .setMaxResults(1)
                .getResultList();
        return rows.stream().findFirst().map(this::toStored);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredSnapshot> findById(long id) {
        return Optional.ofNullable(em.find(SnapshotEntity.class, id)).map(this::toStored);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findRawJsonById(long id) {
        return Optional.ofNullable(em.find(SnapshotEntity.class, id)).map(SnapshotEntity::getRawJson);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SnapshotSummary> listRecent(int limit) {
        return em.createQuery(
                        "select new tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary(s.id, s.takenAt, s.courseCount) "
                                + "from SnapshotEntity s order by s.takenAt desc, s.id desc", SnapshotSummary.class)
                .setMaxResults(Math.max(1, limit))
                .getResultList();
    }

    private StoredSnapshot toStored(SnapshotEntity e) {
        Snapshot snapshot = codec.decode(e.getRawJson());
        log.debug("[Snapshot] Carregado. id={} courses={}", e.getId(), snapshot.size());
        return new StoredSnapshot(e.getId(), e.getTakenAt(), snapshot);
    }
}
