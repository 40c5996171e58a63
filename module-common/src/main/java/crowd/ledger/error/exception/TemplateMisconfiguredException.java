package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ServerBaseException;

public class TemplateMisconfiguredException extends ServerBaseException {
  public TemplateMisconfiguredException(String detail) {
    super(FundingErrorCode.TEMPLATE_MISCONFIGURED, detail);
  }
}
