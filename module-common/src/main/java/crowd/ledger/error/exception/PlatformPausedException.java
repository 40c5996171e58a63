package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class PlatformPausedException extends ClientBaseException {
  public PlatformPausedException() {
    super(FundingErrorCode.PLATFORM_PAUSED);
  }
}
