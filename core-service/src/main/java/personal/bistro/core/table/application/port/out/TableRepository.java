package personal.bistro.core.table.application.port.out;

import personal.bistro.core.table.domain.model.DiningTable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Table Repository (Output Port)
 */
public interface TableRepository {

    Optional<DiningTable> findByTableNumber(int tableNumber);

    List<DiningTable> findAllByTableNumbers(Collection<Integer> tableNumbers);

    List<DiningTable> findAll();

    List<DiningTable> findAllActive();

    DiningTable save(DiningTable table);

    List<DiningTable> saveAll(List<DiningTable> tables);

    long count();
}
