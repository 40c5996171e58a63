package crowd.ledger.controller.dto.project;

/**
 * 후원 요청. assetId가 비어 있으면 네이티브 자산 후원입니다.
 *
 * @param assetId 토큰 자산 ID (선택)
 * @param amount 후원 금액 (subunit)
 */
public record DonationRequest(String assetId, long amount) {

  public boolean isNative() {
    return assetId == null || assetId.isBlank();
  }
}
