package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class InvalidStatusTransitionException extends ClientBaseException {
  public InvalidStatusTransitionException(String from, String to) {
    super(FundingErrorCode.INVALID_STATUS_TRANSITION, from, to);
  }
}
