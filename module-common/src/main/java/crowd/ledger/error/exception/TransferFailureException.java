package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ServerBaseException;

/**
 * 자산 이체 실패 예외
 *
 * <p>이체 결과가 {@code false}이거나 이체 호출 자체가 예외를 던진 경우 모두 이 예외로 규격화됩니다. 자금 이동 연산은 복구 후 계속 진행하는 경로가
 * 없으므로 항상 호출자에게 전파됩니다.
 */
public class TransferFailureException extends ServerBaseException {

  public TransferFailureException(String detail) {
    super(FundingErrorCode.TRANSFER_FAILURE, detail);
  }

  public TransferFailureException(String detail, Throwable cause) {
    super(FundingErrorCode.TRANSFER_FAILURE, cause, detail);
  }
}
