package crowd.ledger.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDateTime;

/**
 * 펀딩 API 성공 응답 봉투
 *
 * <p>실패 응답은 {@link crowd.ledger.global.error.GlobalExceptionHandler}가 {@link
 * crowd.ledger.error.dto.ErrorResponse}로 내려주므로 이 봉투는 성공 경로 전용입니다. 두 응답 모두 같은 형식의 timestamp를 가집니다.
 *
 * @param success 항상 true (ErrorResponse와 구분용)
 * @param data 응답 데이터
 * @param timestamp 응답 생성 시각
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, LocalDateTime timestamp) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data, LocalDateTime.now());
  }
}
