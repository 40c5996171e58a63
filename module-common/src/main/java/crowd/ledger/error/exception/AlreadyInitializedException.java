package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class AlreadyInitializedException extends ClientBaseException {
  public AlreadyInitializedException(long projectId) {
    super(FundingErrorCode.ALREADY_INITIALIZED, projectId);
  }
}
