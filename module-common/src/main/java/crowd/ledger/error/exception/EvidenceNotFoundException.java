package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class EvidenceNotFoundException extends ClientBaseException {
  public EvidenceNotFoundException(int index, int size) {
    super(FundingErrorCode.EVIDENCE_NOT_FOUND, index, size);
  }
}
