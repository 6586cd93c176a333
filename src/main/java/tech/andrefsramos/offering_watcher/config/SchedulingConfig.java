package tech.andrefsramos.offering_watcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/*
 * Ativa os métodos @Scheduled (CollectScheduler). Pode ser desligado com app.collect.enabled=false,
 * útil em testes e em instâncias só de consulta.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.collect", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    public SchedulingConfig() {
        log.info("[Scheduling] Scheduler ativado; a coleta periódica será executada automaticamente.");
    }
}
