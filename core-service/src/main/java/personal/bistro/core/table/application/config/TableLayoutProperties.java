package personal.bistro.core.table.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import personal.bistro.core.table.domain.model.TableLayout;

/**
 * 초기 테이블 배치 설정
 */
@ConfigurationProperties(prefix = "booking.tables")
public record TableLayoutProperties(
        @DefaultValue("22") int count,
        @DefaultValue("10") int smallTableCount,
        @DefaultValue("4") int smallTableCapacity,
        @DefaultValue("6") int largeTableCapacity,
        @DefaultValue("true") boolean initializeOnStartup
) {
    public TableLayout toLayout() {
        return new TableLayout(count, smallTableCount, smallTableCapacity, largeTableCapacity);
    }
}
