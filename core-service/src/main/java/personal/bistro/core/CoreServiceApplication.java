package personal.bistro.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Core Service Application
 * Table Registry, Booking Ledger, Reservation Lifecycle 도메인을 포함하는 예약 서비스
 */
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.bistro.core",
        "personal.bistro.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CoreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoreServiceApplication.class, args);
    }
}
