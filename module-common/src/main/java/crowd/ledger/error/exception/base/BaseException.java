package crowd.ledger.error.exception.base;

import crowd.ledger.error.ErrorCode;
import lombok.Getter;

@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;

  // 기본 생성자
  protected BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  protected BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
  }

  protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
  }
}
