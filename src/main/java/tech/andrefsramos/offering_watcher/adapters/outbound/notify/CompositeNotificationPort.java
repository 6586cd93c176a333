package tech.andrefsramos.offering_watcher.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.ports.NotificationPort;

import java.util.List;

/*
 * CompositeNotificationPort

 * Finalidade

 * Repassa cada relatório de mudanças a todos os canais de notificação registrados.
 * A falha de um canal é registrada e não impede a entrega nos demais. Sem canais configurados,
 * o relatório é apenas registrado no log.
 */
public class CompositeNotificationPort implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(CompositeNotificationPort.class);
    private final List<NotificationPort> delegates;

    public CompositeNotificationPort(List<NotificationPort> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
        log.info("CompositeNotificationPort inicializado com {} canais de notificação.", this.delegates.size());
    }

    @Override
    public void notifyChanges(ChangeReport report) {
        if (report == null || report.isEmpty()) {
            log.debug("notifyChanges: relatório vazio, nada a enviar.");
            return;
        }
        if (delegates.isEmpty()) {
            log.info("notifyChanges: nenhum canal configurado. blocos={} from={} to={}",
                    report.blocks().size(), report.from(), report.to());
            return;
        }

        int ok = 0;
        for (NotificationPort delegate : delegates) {
            String adapterName = delegate.getClass().getSimpleName();
            try {
                delegate.notifyChanges(report);
                ok++;
                log.debug("notifyChanges: envio concluído adapter={}", adapterName);
            } catch (Exception ex) {
                log.warn("notifyChanges: falha ao enviar adapter={} erro={}", adapterName, ex.getMessage(), ex);
            }
        }
        log.info("notifyChanges: blocos={} canaisOk={}/{}", report.blocks().size(), ok, delegates.size());
    }

    public int size() {
        return delegates.size();
    }
}
