package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class NotInitializedException extends ClientBaseException {
  public NotInitializedException(String instanceAddress) {
    super(FundingErrorCode.NOT_INITIALIZED, instanceAddress);
  }
}
