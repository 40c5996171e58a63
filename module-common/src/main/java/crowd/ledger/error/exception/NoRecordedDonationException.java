package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class NoRecordedDonationException extends ClientBaseException {
  public NoRecordedDonationException(long projectId, String donor) {
    super(FundingErrorCode.NO_RECORDED_DONATION, projectId, donor);
  }
}
