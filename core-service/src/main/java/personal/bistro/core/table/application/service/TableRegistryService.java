package personal.bistro.core.table.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.bistro.core.table.application.config.TableLayoutProperties;
import personal.bistro.core.table.application.port.in.GetTableUseCase;
import personal.bistro.core.table.application.port.in.InitializeTablesUseCase;
import personal.bistro.core.table.application.port.in.UpdateTableUseCase;
import personal.bistro.core.table.application.port.out.TableRepository;
import personal.bistro.core.table.domain.exception.TableNotFoundException;
import personal.bistro.core.table.domain.model.DiningTable;

import java.util.List;

/**
 * Table Registry Service
 * 테이블 조회, 관리자 수정, 최초 배치 생성을 담당한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableRegistryService implements GetTableUseCase, UpdateTableUseCase, InitializeTablesUseCase {

    private final TableRepository tableRepository;
    private final TableLayoutProperties layoutProperties;

    @Override
    @Transactional(readOnly = true)
    public DiningTable getTable(int tableNumber) {
        return tableRepository.findByTableNumber(tableNumber)
                .orElseThrow(() -> new TableNotFoundException(tableNumber));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DiningTable> getAllTables() {
        return tableRepository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public List<DiningTable> getActiveTables() {
        return tableRepository.findAllActive();
    }

    @Override
    @Transactional
    public DiningTable updateTable(UpdateTableCommand command) {
        DiningTable current = getTable(command.tableNumber());
        DiningTable updated = current.update(command.capacity(), command.notes(), command.active());

        DiningTable saved = tableRepository.save(updated);
        log.info("Table updated: tableNumber={}, capacity={}, active={}",
                saved.tableNumber(), saved.capacity(), saved.active());
        return saved;
    }

    @Override
    @Transactional
    public int initialize() {
        long existing = tableRepository.count();
        if (existing > 0) {
            log.debug("Table registry already initialized: count={}", existing);
            return 0;
        }

        List<DiningTable> tables = layoutProperties.toLayout().tables();
        tableRepository.saveAll(tables);
        log.info("Table registry initialized: count={}", tables.size());
        return tables.size();
    }
}
