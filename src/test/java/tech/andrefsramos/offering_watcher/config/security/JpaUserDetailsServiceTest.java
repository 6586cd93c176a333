package tech.andrefsramos.offering_watcher.config.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import tech.andrefsramos.offering_watcher.adapters.outbound.persistence.entity.UserEntity;
import tech.andrefsramos.offering_watcher.core.domain.Role;
import tech.andrefsramos.offering_watcher.core.ports.UserRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class JpaUserDetailsServiceTest {

    private final UserRepository repository = mock(UserRepository.class);
    private final JpaUserDetailsService service = new JpaUserDetailsService(repository);

    @Test
    void administratorGetsAdminAuthority() {
        UserEntity admin = new UserEntity();
        admin.setUsername("admin");
        admin.setPassword("{bcrypt}hash");
        admin.setRole(Role.ADMIN);
        when(repository.findByUsername("admin")).thenReturn(Optional.of(admin));

        UserDetails details = service.loadUserByUsername("admin");

        assertThat(details.getAuthorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_ADMIN");
        assertThat(details.isEnabled()).isTrue();
    }

    @Test
    void unknownUserIsRejected() {
        when(repository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.loadUserByUsername("ghost"))
                .isInstanceOf(UsernameNotFoundException.class)
                .hasMessageContaining("ghost");
    }
}
