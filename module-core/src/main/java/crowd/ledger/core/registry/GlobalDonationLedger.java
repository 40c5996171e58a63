package crowd.ledger.core.registry;

import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.domain.model.account.Address;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 플랫폼 전역 후원 원장
 *
 * <p>후원자별 누적액, 최초 후원 순서의 고유 후원자 목록, 후원 건수, 전체 모금액을 보관합니다. 프로젝트 환불은 이 원장을 차감하지 않습니다. 레지스트리 락
 * 안에서만 변경됩니다.
 *
 * <p>기록은 비동기로 순서 없이 도착할 수 있으므로 후원자 순서는 도착 순서가 아니라 커밋 시점에 발급된 순번으로 정합니다.
 */
public class GlobalDonationLedger {

  private final Map<Address, Long> totals = new HashMap<>();
  private final Map<Address, Long> firstSequence = new HashMap<>();
  private long donationCount;
  private long totalRaised;

  /** 오버플로우가 하나라도 발생하면 어떤 값도 바뀌지 않습니다. */
  public void record(Address donor, long amount, long sequence) {
    long donorTotal = FundingRules.addChecked(donationOf(donor), amount, "global donor total");
    long raised = FundingRules.addChecked(totalRaised, amount, "global funds raised");
    long count = FundingRules.addChecked(donationCount, 1, "global donation count");

    totals.put(donor, donorTotal);
    firstSequence.merge(donor, sequence, Math::min);
    totalRaised = raised;
    donationCount = count;
  }

  public long donationOf(Address donor) {
    return totals.getOrDefault(donor, 0L);
  }

  public int donorCount() {
    return totals.size();
  }

  public long donationCount() {
    return donationCount;
  }

  public long totalRaised() {
    return totalRaised;
  }

  /** 최초 후원 순번 순서의 스냅샷 */
  public Map<Address, Long> snapshot() {
    List<Address> donors = new ArrayList<>(totals.keySet());
    donors.sort((a, b) -> Long.compare(firstSequence.get(a), firstSequence.get(b)));
    Map<Address, Long> ordered = new LinkedHashMap<>();
    for (Address donor : donors) {
      ordered.put(donor, totals.get(donor));
    }
    return ordered;
  }
}
