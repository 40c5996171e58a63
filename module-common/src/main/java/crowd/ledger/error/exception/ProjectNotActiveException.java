package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class ProjectNotActiveException extends ClientBaseException {
  public ProjectNotActiveException(long projectId, String status) {
    super(FundingErrorCode.PROJECT_NOT_ACTIVE, projectId, status);
  }
}
