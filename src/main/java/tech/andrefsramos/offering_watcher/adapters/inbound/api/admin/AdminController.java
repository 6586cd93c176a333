package tech.andrefsramos.offering_watcher.adapters.inbound.api.admin;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.offering_watcher.core.application.CollectCoursesUseCase;
import tech.andrefsramos.offering_watcher.core.domain.CollectionOutcome;

import java.util.Optional;

/**
 * AdminController

 * Operações administrativas: força uma passada de coleta fora do agendamento.
 * Acesso restrito ao papel ADMIN (HTTP Basic).
 */
@RestController
@RequestMapping("/admin")
@Tag(
        name = "02",
        description = """
## ADMIN
---
Operações administrativas.

### ⚙️ Funcionalidades disponíveis
- Forçar imediatamente uma passada de coleta da oferta de disciplinas

### 🔐 Segurança
- Acesso **restrito** a usuários com papel **ADMIN**
- Autenticação HTTP Basic: `Authorization: Basic <base64(usuario:senha)>`
"""
)
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);
    private final CollectCoursesUseCase collect;

    public AdminController(CollectCoursesUseCase collect) {
        this.collect = collect;
    }

    @PostMapping("/collect")
    @Operation(
            summary = "Força uma passada de coleta",
            description = """
                Executa login no portal, coleta todos os departamentos configurados, arquiva o snapshot
                e notifica as mudanças em relação ao snapshot anterior.

                ⚠️ Regras:
                    - Acesso restrito a administradores (ROLE_ADMIN)
                    - Se outra passada estiver em andamento, retorna 409
                    - Falha de login/transporte aborta a passada (nada é arquivado) e retorna 502
            """,
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Passada concluída",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = CollectResponse.class),
                                    examples = @ExampleObject(value = """
                                            {"snapshotId":12,"previousSnapshotId":11,"takenAt":"2025-01-20T10:00:00Z",
                                             "departments":50,"courses":2480,"added":3,"removed":1,"updated":17}
                                            """)
                            )
                    ),
                    @ApiResponse(responseCode = "401", description = "Usuário não autenticado"),
                    @ApiResponse(responseCode = "403", description = "Usuário sem papel ADMIN"),
                    @ApiResponse(responseCode = "409", description = "Outra passada em andamento"),
                    @ApiResponse(responseCode = "502", description = "Falha ao coletar do portal")
            }
    )
    public ResponseEntity<?> collect() {
        log.info("AdminController: solicitação de coleta manual recebida.");

        try {
            Optional<CollectionOutcome> outcome = collect.collectOnce();
            if (outcome.isEmpty()) {
                log.warn("AdminController: coleta recusada, outra passada em andamento.");
                return ResponseEntity.status(HttpStatus.CONFLICT).body("Another collect pass is already running.");
            }
            log.info("AdminController: coleta concluída snapshotId={}", outcome.get().snapshotId());
            return ResponseEntity.ok(CollectResponse.from(outcome.get()));

        } catch (Exception ex) {
            log.error("AdminController: erro ao executar coleta manual", ex);
            return ResponseEntity
                    .status(HttpStatus.BAD_GATEWAY)
                    .body("Error during collect: " + ex.getMessage());
        }
    }
}
