package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

/**
 * 금액 검증 실패 예외
 *
 * <p>최소 후원 금액 미만, 0 이하의 목표 금액, 누적 합계 오버플로우 등에 사용합니다.
 */
public class InvalidAmountException extends ClientBaseException {

  public InvalidAmountException(String detail) {
    super(FundingErrorCode.INVALID_AMOUNT, detail);
  }

  /** 최소값 미달 생성자 */
  public InvalidAmountException(long amount, long minimum) {
    super(FundingErrorCode.INVALID_AMOUNT, amount + " (최소: " + minimum + ")");
  }
}
