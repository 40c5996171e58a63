package crowd.ledger.domain.model.registry;

import crowd.ledger.domain.model.account.Address;
import java.util.List;

/**
 * 리더보드 구간 조회 결과
 *
 * <p>donors와 amounts는 같은 길이의 병렬 시퀀스이며, 인덱스 i는 (start + i)위를 의미합니다.
 */
public record LeaderboardPage(List<Address> donors, List<Long> amounts) {

  public LeaderboardPage {
    donors = List.copyOf(donors);
    amounts = List.copyOf(amounts);
    if (donors.size() != amounts.size()) {
      throw new IllegalArgumentException("donors/amounts size mismatch");
    }
  }

  public static LeaderboardPage empty() {
    return new LeaderboardPage(List.of(), List.of());
  }

  public boolean isEmpty() {
    return donors.isEmpty();
  }

  public int size() {
    return donors.size();
  }
}
