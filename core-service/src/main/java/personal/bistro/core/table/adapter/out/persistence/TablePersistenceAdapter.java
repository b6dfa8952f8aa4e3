package personal.bistro.core.table.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.bistro.core.table.application.port.out.TableRepository;
import personal.bistro.core.table.domain.model.DiningTable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Table Persistence Adapter
 * Domain Port 구현체
 */
@Component
@RequiredArgsConstructor
public class TablePersistenceAdapter implements TableRepository {

    private final JpaDiningTableRepository jpaDiningTableRepository;

    @Override
    public Optional<DiningTable> findByTableNumber(int tableNumber) {
        return jpaDiningTableRepository.findById(tableNumber)
                .map(DiningTableEntity::toDomain);
    }

    @Override
    public List<DiningTable> findAllByTableNumbers(Collection<Integer> tableNumbers) {
        return jpaDiningTableRepository.findByTableNumberIn(tableNumbers).stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public List<DiningTable> findAll() {
        return jpaDiningTableRepository.findAllByOrderByTableNumberAsc().stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public List<DiningTable> findAllActive() {
        return jpaDiningTableRepository.findByActiveTrueOrderByTableNumberAsc().stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public DiningTable save(DiningTable table) {
        DiningTableEntity entity = jpaDiningTableRepository.findById(table.tableNumber())
                .map(existing -> {
                    existing.apply(table);
                    return existing;
                })
                .orElseGet(() -> DiningTableEntity.fromDomain(table));
        return jpaDiningTableRepository.save(entity).toDomain();
    }

    @Override
    public List<DiningTable> saveAll(List<DiningTable> tables) {
        List<DiningTableEntity> entities = tables.stream()
                .map(DiningTableEntity::fromDomain)
                .toList();
        return jpaDiningTableRepository.saveAll(entities).stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public long count() {
        return jpaDiningTableRepository.count();
    }
}
