package tech.andrefsramos.offering_watcher.config.security;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.password.PasswordEncoder;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity.UserEntity;
import tech.andrefsramos.offering_watcher.core.domain.Role;
import tech.andrefsramos.offering_watcher.core.ports.UserRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DatabaseInitializerConfigTest {

    private final UserRepository repository = mock(UserRepository.class);
    private final PasswordEncoder encoder = mock(PasswordEncoder.class);

    @Test
    void seedsEnabledAdministratorOnFirstStart() throws Exception {
        when(repository.existsByUsername("ops")).thenReturn(false);
        when(encoder.encode("s3cret")).thenReturn("{bcrypt}hash");

        new DatabaseInitializerConfig().initDefaultUsers(repository, encoder, "ops", "s3cret").run();

        ArgumentCaptor<UserEntity> saved = ArgumentCaptor.forClass(UserEntity.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getUsername()).isEqualTo("ops");
        assertThat(saved.getValue().getPassword()).isEqualTo("{bcrypt}hash");
        assertThat(saved.getValue().getRole()).isEqualTo(Role.ADMIN);
        assertThat(saved.getValue().isEnabled()).isTrue();
    }

    @Test
    void existingAdministratorIsLeftUntouched() throws Exception {
        when(repository.existsByUsername("admin")).thenReturn(true);

        new DatabaseInitializerConfig().initDefaultUsers(repository, encoder, "admin", "admin").run();

        verify(repository, never()).save(any());
        verifyNoInteractions(encoder);
    }
}
