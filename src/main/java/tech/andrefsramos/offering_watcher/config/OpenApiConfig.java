package tech.andrefsramos.offering_watcher.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Offering Watcher - API do arquivo de ofertas de disciplinas",
                version = "v1",
                description = """
                                ---

                                ## 🎯 Visão Geral

                                O serviço faz login periodicamente no portal de matrícula, coleta a página de oferta
                                de cada departamento, arquiva o resultado como um **snapshot** e envia ao Telegram
                                um relatório das disciplinas adicionadas, removidas e alteradas.

                                ---

                                ## 🔐 Autenticação

                                ### Endpoints públicos
                                - `GET /api/v1/snapshots`
                                - `GET /api/v1/snapshots/{id}/raw`
                                - `GET /api/v1/snapshots/diff?from=&to=`

                                ### Endpoints protegidos (ADMIN, HTTP Basic)
                                - `POST /admin/collect`

                                Na primeira inicialização é criado o usuário administrador definido em
                                `app.security.admin.username` / `app.security.admin.password`.

                                ---

                                ### 📌 Tratamento de erros resumido
                                | **Código** | **Significado** |
                                |--------|-------------|
                                | **200** | Sucesso |
                                | **204** | Sem resultados |
                                | **401** | Credenciais ausentes ou incorretas |
                                | **403** | Usuário sem permissão |
                                | **404** | Snapshot inexistente |
                                | **409** | Coleta já em andamento |
                                | **502** | Falha ao coletar do portal |

                                ---
                                """
        )
)
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .components(new Components()
                        .addSecuritySchemes("basicAuth",
                                new SecurityScheme()
                                        .name("basicAuth")
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("basic")
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList("basicAuth"));
    }
}
