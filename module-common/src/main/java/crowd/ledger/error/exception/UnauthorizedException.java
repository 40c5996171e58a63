package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class UnauthorizedException extends ClientBaseException {

  /**
   * @param caller 호출자 식별자
   * @param required 필요한 권한 (역할 이름 또는 "project-admin" 등)
   */
  public UnauthorizedException(String caller, String required) {
    super(FundingErrorCode.UNAUTHORIZED, caller, required);
  }
}
