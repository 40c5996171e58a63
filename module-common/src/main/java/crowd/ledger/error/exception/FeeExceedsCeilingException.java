package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class FeeExceedsCeilingException extends ClientBaseException {
  public FeeExceedsCeilingException(int requestedBasisPoints, int ceilingBasisPoints) {
    super(FundingErrorCode.FEE_EXCEEDS_CEILING, requestedBasisPoints, ceilingBasisPoints);
  }
}
