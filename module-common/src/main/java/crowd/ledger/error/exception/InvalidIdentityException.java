package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class InvalidIdentityException extends ClientBaseException {
  public InvalidIdentityException(String detail) {
    super(FundingErrorCode.INVALID_IDENTITY, detail);
  }
}
