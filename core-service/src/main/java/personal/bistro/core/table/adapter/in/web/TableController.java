package personal.bistro.core.table.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.bistro.core.auth.Requester;
import personal.bistro.core.table.adapter.in.web.dto.InitializeTablesResponse;
import personal.bistro.core.table.adapter.in.web.dto.TableResponse;
import personal.bistro.core.table.adapter.in.web.dto.UpdateTableRequest;
import personal.bistro.core.table.application.port.in.GetTableUseCase;
import personal.bistro.core.table.application.port.in.InitializeTablesUseCase;
import personal.bistro.core.table.application.port.in.UpdateTableUseCase;
import personal.bistro.core.table.domain.model.DiningTable;

import java.util.List;

/**
 * Table Registry API Controller
 * 전체 조회, 수정, 초기화는 관리자 전용이다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tables")
@RequiredArgsConstructor
public class TableController {

    private final GetTableUseCase getTableUseCase;
    private final UpdateTableUseCase updateTableUseCase;
    private final InitializeTablesUseCase initializeTablesUseCase;

    /**
     * 전체 테이블 조회 (관리자)
     * GET /api/v1/tables
     */
    @GetMapping
    public ResponseEntity<List<TableResponse>> getAllTables(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Requester.of(userId, role).ensureAdmin();

        List<TableResponse> response = getTableUseCase.getAllTables().stream()
                .map(TableResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 예약 가능한 활성 테이블 조회
     * GET /api/v1/tables/active
     */
    @GetMapping("/active")
    public ResponseEntity<List<TableResponse>> getActiveTables() {
        List<TableResponse> response = getTableUseCase.getActiveTables().stream()
                .map(TableResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 단일 테이블 조회
     * GET /api/v1/tables/{tableNumber}
     */
    @GetMapping("/{tableNumber}")
    public ResponseEntity<TableResponse> getTable(@PathVariable int tableNumber) {
        return ResponseEntity.ok(TableResponse.from(getTableUseCase.getTable(tableNumber)));
    }

    /**
     * 테이블 속성 수정 (관리자)
     * PUT /api/v1/tables/{tableNumber}
     */
    @PutMapping("/{tableNumber}")
    public ResponseEntity<TableResponse> updateTable(
            @PathVariable int tableNumber,
            @RequestBody UpdateTableRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Requester.of(userId, role).ensureAdmin();
        log.info("Update table: tableNumber={}, userId={}", tableNumber, userId);

        DiningTable updated = updateTableUseCase.updateTable(request.toCommand(tableNumber));
        return ResponseEntity.ok(TableResponse.from(updated));
    }

    /**
     * 기본 테이블 배치 생성 (관리자, 이미 존재하면 변경 없음)
     * POST /api/v1/tables/initialize
     */
    @PostMapping("/initialize")
    public ResponseEntity<InitializeTablesResponse> initialize(
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader(value = "X-User-Role", required = false) String role
    ) {
        Requester.of(userId, role).ensureAdmin();

        int created = initializeTablesUseCase.initialize();
        log.info("Tables initialize requested: userId={}, created={}", userId, created);
        return ResponseEntity.ok(InitializeTablesResponse.of(created));
    }
}
