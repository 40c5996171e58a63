package crowd.ledger.core.project;

import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.core.registry.AssetAllowlist;
import crowd.ledger.domain.model.account.Address;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 프로젝트 단위 후원 원장
 *
 * <ul>
 *   <li>후원자별 누적액 (모든 자산 합산)
 *   <li>후원자별 기본 자산 기여분 (환불 대상)
 *   <li>자산별 보관 중인 토큰 잔액
 *   <li>최초 후원 순서의 고유 후원자 목록
 * </ul>
 *
 * <p>소유 인스턴스의 락 안에서만 접근합니다.
 */
final class DonationLedger {

  private final Map<Address, Long> totals = new HashMap<>();
  private final Map<Address, Long> nativeContributions = new HashMap<>();
  private final Map<String, Long> heldTokens = new HashMap<>();
  private final Set<Address> donors = new LinkedHashSet<>();

  long donationOf(Address donor) {
    return totals.getOrDefault(donor, 0L);
  }

  long nativeContributionOf(Address donor) {
    return nativeContributions.getOrDefault(donor, 0L);
  }

  long heldTokenBalance(String assetId) {
    return heldTokens.getOrDefault(assetId, 0L);
  }

  List<Address> donors() {
    return List.copyOf(donors);
  }

  int donorCount() {
    return donors.size();
  }

  /** 반영 전에 오버플로우를 확인합니다. 상태는 변경하지 않습니다. */
  void checkCredit(Address donor, String assetId, long amount) {
    FundingRules.addChecked(donationOf(donor), amount, "donor total");
    if (AssetAllowlist.NATIVE_ASSET.equals(assetId)) {
      FundingRules.addChecked(nativeContributionOf(donor), amount, "native contribution");
    } else {
      FundingRules.addChecked(heldTokenBalance(assetId), amount, "held token balance");
    }
  }

  void credit(Address donor, String assetId, long amount) {
    totals.merge(donor, amount, Long::sum);
    if (AssetAllowlist.NATIVE_ASSET.equals(assetId)) {
      nativeContributions.merge(donor, amount, Long::sum);
    } else {
      heldTokens.merge(assetId, amount, Long::sum);
    }
    donors.add(donor);
  }

  /**
   * 후원자 기록을 0으로 초기화합니다. 토큰 잔액은 그대로 보관됩니다.
   *
   * @return 초기화 직전의 누적액
   */
  long clear(Address donor) {
    Long previous = totals.put(donor, 0L);
    nativeContributions.remove(donor);
    return previous == null ? 0L : previous;
  }

  /** 모든 후원자 기록과 후원자 목록을 비웁니다. */
  void clearAll() {
    totals.clear();
    nativeContributions.clear();
    donors.clear();
  }
}
