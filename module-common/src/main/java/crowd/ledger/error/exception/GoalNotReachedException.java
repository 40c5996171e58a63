package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class GoalNotReachedException extends ClientBaseException {
  public GoalNotReachedException(long fundsRaised, long goal) {
    super(FundingErrorCode.GOAL_NOT_REACHED, fundsRaised, goal);
  }
}
