package crowd.ledger.error.dto;

import crowd.ledger.error.ErrorCode;
import crowd.ledger.error.exception.base.BaseException;
import java.time.LocalDateTime;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String message;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder message(String message) {
      this.message = message;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "S001",
          message != null ? message : "Unknown error",
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /**
   * Create ErrorResponse from BaseException (business exception with dynamic message)
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 프로젝트가 없는지)를 전달합니다.
   */
  public static ErrorResponse from(BaseException e) {
    return ErrorResponse.builder()
        .status(e.getErrorCode().getStatusCode())
        .code(e.getErrorCode().getCode())
        .message(e.getMessage())
        .timestamp(LocalDateTime.now())
        .build();
  }

  /**
   * Create ErrorResponse from ErrorCode (system exception with static message)
   *
   * <p>ErrorCode Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ErrorResponse from(ErrorCode errorCode) {
    return ErrorResponse.builder()
        .status(errorCode.getStatusCode())
        .code(errorCode.getCode())
        .message(errorCode.getMessage())
        .timestamp(LocalDateTime.now())
        .build();
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus()).body(from(e));
  }

  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus()).body(from(errorCode));
  }
}
