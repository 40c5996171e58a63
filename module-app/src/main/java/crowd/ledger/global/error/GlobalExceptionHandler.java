package crowd.ledger.global.error;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.dto.ErrorResponse;
import crowd.ledger.error.exception.base.BaseException;
import crowd.ledger.error.exception.base.ServerBaseException;
import java.time.LocalDateTime;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 비즈니스 예외 처리 (동적 메시지 포함)
   *
   * <p>클라이언트 오류는 warn, 서버 오류(이체 실패, 템플릿 설정 오류)는 원인과 함께 error로 남깁니다.
   */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error(
          "Server Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage(), e);
    } else {
      log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return invalidRequest(detail);
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  protected ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
    return invalidRequest("missing header " + e.getHeaderName());
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  protected ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
    return invalidRequest("malformed request");
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 숨기고 공통 코드만 반환합니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(FundingErrorCode.INTERNAL_SERVER_ERROR);
  }

  private ResponseEntity<ErrorResponse> invalidRequest(String detail) {
    FundingErrorCode code = FundingErrorCode.INVALID_REQUEST;
    log.warn("Invalid Request: {} | {}", code.getCode(), detail);
    ErrorResponse body =
        ErrorResponse.builder()
            .status(code.getStatusCode())
            .code(code.getCode())
            .message(String.format(code.getMessage(), detail))
            .timestamp(LocalDateTime.now())
            .build();
    return ResponseEntity.status(code.getStatus()).body(body);
  }
}
