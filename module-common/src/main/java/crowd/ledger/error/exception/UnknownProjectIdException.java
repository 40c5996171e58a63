package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class UnknownProjectIdException extends ClientBaseException {
  public UnknownProjectIdException(long projectId) {
    super(FundingErrorCode.UNKNOWN_PROJECT_ID, projectId);
  }
}
