package crowd.ledger.core.registry;

import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 리더보드 순위 계산
 *
 * <p>누적액 내림차순의 안정 정렬입니다. 동액이면 최초 후원 순서를 유지합니다.
 */
public final class LeaderboardRanker {

  private LeaderboardRanker() {}

  /**
   * @param totalsInInsertionOrder 최초 후원 순서로 정렬된 누적액
   * @param start 시작 순위 (포함, 0부터)
   * @param end 끝 순위 (제외). 후원자 수를 넘으면 잘라냅니다.
   */
  public static LeaderboardPage rank(Map<Address, Long> totalsInInsertionOrder, int start, int end) {
    int count = totalsInInsertionOrder.size();
    if (start < 0 || start >= end || start >= count) {
      return LeaderboardPage.empty();
    }

    List<Map.Entry<Address, Long>> ranked = new ArrayList<>(totalsInInsertionOrder.entrySet());
    ranked.sort(Map.Entry.<Address, Long>comparingByValue(Comparator.reverseOrder()));

    int to = Math.min(end, count);
    List<Address> donors = new ArrayList<>(to - start);
    List<Long> amounts = new ArrayList<>(to - start);
    for (Map.Entry<Address, Long> entry : ranked.subList(start, to)) {
      donors.add(entry.getKey());
      amounts.add(entry.getValue());
    }
    return new LeaderboardPage(donors, amounts);
  }
}
