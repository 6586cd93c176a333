package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.offering_watcher.core.domain.Department;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DepartmentCatalogTest {

    @Test
    void catalogListsEveryPortalDepartment() {
        List<Department> all = DepartmentCatalog.all();

        assertThat(all).hasSize(50);
        assertThat(all.get(0)).isEqualTo(new Department(20, "مهندسی_عمران"));
        assertThat(all).contains(new Department(40, "مهندسی_کامپیوتر"));
    }

    @Test
    void selectKeepsCatalogOrder() {
        List<Department> selected = DepartmentCatalog.select(List.of("40", " 22 "));

        assertThat(selected).extracting(Department::code).containsExactly(22, 40);
    }

    @Test
    void unknownIdsAreIgnored() {
        assertThat(DepartmentCatalog.select(List.of("40", "9999", "abc")))
                .extracting(Department::code).containsExactly(40);
    }

    @Test
    void noValidIdSelectsEverything() {
        assertThat(DepartmentCatalog.select(List.of())).hasSize(50);
        assertThat(DepartmentCatalog.select(null)).hasSize(50);
        assertThat(DepartmentCatalog.select(List.of("abc"))).hasSize(50);
    }
}
