package crowd.ledger.error.exception.base;

import crowd.ledger.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이나 권한, 프로젝트 상태가 요청과 맞지 않을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며,
 * 호출자에게 구체적인 실패 원인을 전달하는 것이 목적입니다.
 *
 * <p>이 계열의 예외는 항상 상태 변경 전에 던져지므로, 실패한 호출은 어떤 부분 변경도 남기지 않습니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
