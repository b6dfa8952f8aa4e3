package personal.bistro.core.table.adapter.in.startup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import personal.bistro.core.table.application.port.in.InitializeTablesUseCase;

/**
 * 애플리케이션 기동 시 테이블 레지스트리가 비어 있으면 기본 배치를 생성한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "booking.tables.initialize-on-startup", havingValue = "true", matchIfMissing = true)
public class TableRegistryInitializer implements ApplicationRunner {

    private final InitializeTablesUseCase initializeTablesUseCase;

    @Override
    public void run(ApplicationArguments args) {
        int created = initializeTablesUseCase.initialize();
        if (created > 0) {
            log.info("Default table layout created on startup: {} tables", created);
        }
    }
}
