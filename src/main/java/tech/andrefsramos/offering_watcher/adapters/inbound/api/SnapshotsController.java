package tech.andrefsramos.offering_watcher.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.offering_watcher.core.application.QuerySnapshotsUseCase;
import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.domain.SnapshotSummary;

import java.util.List;
import java.util.Optional;

/**
 * SnapshotsController

 * Leitura do arquivo de snapshots: listagem, exportação do JSON persistido e diff histórico
 * entre dois snapshots quaisquer.
 */
@RestController
@Validated
@RequestMapping("/api/v1/snapshots")
@Tag(name = "01 - Snapshots")
public class SnapshotsController {

    private static final Logger log = LoggerFactory.getLogger(SnapshotsController.class);
    private static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final QuerySnapshotsUseCase query;

    public SnapshotsController(QuerySnapshotsUseCase query) {this.query = query;}

    @GetMapping
    @Operation(
            summary = "Lista os snapshots arquivados mais recentes",
            description = "Retorna id, instante da coleta e quantidade de registros, do mais recente para o mais antigo. `limit` aceita de 1 a 100; fora disso responde 400.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Lista de snapshots",
                            content = @Content(mediaType = "application/json",
                                    array = @ArraySchema(schema = @Schema(implementation = SnapshotSummary.class)))),
                    @ApiResponse(responseCode = "204", description = "Nenhum snapshot arquivado"),
                    @ApiResponse(responseCode = "400", description = "limit fora de 1..100"),
                    @ApiResponse(responseCode = "500", description = "Erro interno na consulta")
            }
    )
    public ResponseEntity<List<SnapshotSummary>> list(
            @Parameter(description = "Quantidade máxima de itens (1..100)", example = "20")
            @RequestParam(name = "limit", required = false) @Min(1) @Max(MAX_LIMIT) Integer limit
    ) {
        final long t0 = System.nanoTime();
        int eff = (limit == null) ? DEFAULT_LIMIT : limit;
        try {
            List<SnapshotSummary> items = query.listRecent(eff);
            log.info("[Query] GET /api/v1/snapshots limit={} -> {} itens ({} ms)",
                    eff, items.size(), (System.nanoTime() - t0) / 1_000_000);
            if (items.isEmpty()) return ResponseEntity.noContent().build();
            return ResponseEntity.ok(items);
        } catch (Exception e) {
            log.error("[Query] Falha ao listar snapshots limit={}: {}", eff, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping(value = "/{id}/raw", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Exporta o JSON persistido de um snapshot",
            responses = {
                    @ApiResponse(responseCode = "200", description = "JSON do snapshot (chave código-turma)"),
                    @ApiResponse(responseCode = "404", description = "Snapshot inexistente")
            }
    )
    public ResponseEntity<String> raw(@PathVariable("id") long id) {
        Optional<String> json = query.rawJson(id);
        if (json.isEmpty()) {
            log.info("[Query] Snapshot id={} não encontrado.", id);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(json.get());
    }

    @GetMapping("/diff")
    @Operation(
            summary = "Relatório de mudanças entre dois snapshots",
            description = "Compara os snapshots `from` (anterior) e `to` (atual) e devolve um bloco de texto por departamento.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Relatório (blocks vazio quando não há mudanças)",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = ChangeReport.class))),
                    @ApiResponse(responseCode = "404", description = "Algum dos snapshots não existe"),
                    @ApiResponse(responseCode = "500", description = "Erro interno ao comparar")
            }
    )
    public ResponseEntity<ChangeReport> diff(
            @Parameter(description = "Id do snapshot anterior", example = "11") @RequestParam("from") long from,
            @Parameter(description = "Id do snapshot atual", example = "12") @RequestParam("to") long to
    ) {
        final long t0 = System.nanoTime();
        try {
            Optional<ChangeReport> report = query.compare(from, to);
            log.info("[Query] GET /api/v1/snapshots/diff from={} to={} encontrado={} ({} ms)",
                    from, to, report.isPresent(), (System.nanoTime() - t0) / 1_000_000);
            return report.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            log.error("[Query] Falha ao comparar snapshots from={} to={}: {}", from, to, e.getMessage(), e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<String> invalidParameter(ConstraintViolationException e) {
        log.warn("[Query] Parâmetro inválido: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
