package tech.andrefsramos.offering_watcher.config.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity.UserEntity;
import tech.andrefsramos.offering_watcher.core.domain.Role;
import tech.andrefsramos.offering_watcher.core.ports.UserRepository;

/*
 * Cria o administrador padrão na primeira inicialização (app.security.admin.*).
 * Usuário já existente não é alterado.
 */
@Configuration
public class DatabaseInitializerConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseInitializerConfig.class);

    @Bean
    public CommandLineRunner initDefaultUsers(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.security.admin.username:admin}") String username,
            @Value("${app.security.admin.password:admin}") String password
    ) {
        return args -> {
            if (userRepository.existsByUsername(username)) {
                log.debug("[Security] Usuário administrador '{}' já existe.", username);
                return;
            }
            UserEntity admin = new UserEntity();
            admin.setUsername(username);
            admin.setPassword(passwordEncoder.encode(password));
            admin.setRole(Role.ADMIN);
            admin.setEnabled(true);
            userRepository.save(admin);

            if ("admin".equals(password)) {
                log.warn("[Security] Administrador '{}' criado com a senha padrão. Defina ADMIN_PASSWORD em produção.", username);
            } else {
                log.info("[Security] Administrador '{}' criado.", username);
            }
        };
    }
}
