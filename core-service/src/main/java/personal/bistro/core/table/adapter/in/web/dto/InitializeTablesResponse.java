package personal.bistro.core.table.adapter.in.web.dto;

/**
 * 테이블 초기화 응답 DTO
 *
 * @param createdCount       이번 호출로 생성된 테이블 수
 * @param alreadyInitialized 이미 테이블이 있어 아무것도 만들지 않았는지 여부
 */
public record InitializeTablesResponse(
        int createdCount,
        boolean alreadyInitialized
) {
    public static InitializeTablesResponse of(int createdCount) {
        return new InitializeTablesResponse(createdCount, createdCount == 0);
    }
}
