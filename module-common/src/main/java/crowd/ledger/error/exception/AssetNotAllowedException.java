package crowd.ledger.error.exception;

import crowd.ledger.error.FundingErrorCode;
import crowd.ledger.error.exception.base.ClientBaseException;

public class AssetNotAllowedException extends ClientBaseException {
  public AssetNotAllowedException(String assetId) {
    super(FundingErrorCode.ASSET_NOT_ALLOWED, assetId);
  }
}
