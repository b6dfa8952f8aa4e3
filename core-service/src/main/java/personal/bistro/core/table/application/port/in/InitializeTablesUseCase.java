package personal.bistro.core.table.application.port.in;

/**
 * 테이블 레지스트리 초기화 Use Case
 * 테이블이 하나도 없을 때만 기본 배치를 생성한다.
 */
public interface InitializeTablesUseCase {

    /**
     * @return 새로 생성된 테이블 수 (이미 초기화된 경우 0)
     */
    int initialize();
}
