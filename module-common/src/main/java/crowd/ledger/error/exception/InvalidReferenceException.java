package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class InvalidReferenceException extends ClientBaseException {
  public InvalidReferenceException(String detail) {
    super(FundingErrorCode.INVALID_REFERENCE, detail);
  }
}
