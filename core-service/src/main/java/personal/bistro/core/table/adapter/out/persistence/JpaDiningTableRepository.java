package personal.bistro.core.table.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA Repository for Dining Table
 */
public interface JpaDiningTableRepository extends JpaRepository<DiningTableEntity, Integer> {

    List<DiningTableEntity> findAllByOrderByTableNumberAsc();

    List<DiningTableEntity> findByActiveTrueOrderByTableNumberAsc();

    List<DiningTableEntity> findByTableNumberIn(Collection<Integer> tableNumbers);
}
