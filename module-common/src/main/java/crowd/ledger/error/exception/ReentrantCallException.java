package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

/** 동일 인스턴스에 대한 중첩 변경 호출(예: 악성 자산의 이체 훅에서 다시 후원 호출)을 거부할 때 발생합니다. */
public class ReentrantCallException extends ClientBaseException {
  public ReentrantCallException(String target) {
    super(FundingErrorCode.REENTRANT_CALL, target);
  }
}
