package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class AlreadyReleasedException extends ClientBaseException {
  public AlreadyReleasedException(long projectId) {
    super(FundingErrorCode.ALREADY_RELEASED, projectId);
  }
}
