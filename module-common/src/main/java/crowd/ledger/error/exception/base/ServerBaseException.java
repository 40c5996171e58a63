package crowd.ledger.error.exception.base;

import crowd.ledger.error.ErrorCode;

/**
 * ServerBaseException: 외부 협력자(자산 이체, 템플릿 등) 또는 시스템 내부 오류로 발생하는 '서버 예외' 5xx 계열의 에러를 처리하며, 장애 회고를
 * 위한 상세 로그를 남기는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
