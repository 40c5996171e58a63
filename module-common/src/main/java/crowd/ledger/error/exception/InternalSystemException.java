package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ServerBaseException;
import lombok.Getter;

/** LogicExecutor가 비즈니스 예외가 아닌 checked 예외를 규격화할 때 사용합니다. */
@Getter
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(FundingErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }
}
