package crowd.ledger.core.registry;

import static org.assertj.core.api.Assertions.assertThat;

import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LeaderboardRankerTest {

  private static Map<Address, Long> totals(Object... pairs) {
    Map<Address, Long> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(Address.of((String) pairs[i]), ((Number) pairs[i + 1]).longValue());
    }
    return map;
  }

  @Test
  @DisplayName("end는 후원자 수로 잘린다")
  void clampsEnd() {
    LeaderboardPage page = LeaderboardRanker.rank(totals("a", 10, "b", 30), 0, 100);

    assertThat(page.donors()).extracting(Address::value).containsExactly("b", "a");
    assertThat(page.amounts()).containsExactly(30L, 10L);
  }

  @Test
  @DisplayName("빈 원장과 역전된 구간은 빈 페이지")
  void emptyCases() {
    assertThat(LeaderboardRanker.rank(Map.of(), 0, 10).isEmpty()).isTrue();
    assertThat(LeaderboardRanker.rank(totals("a", 10), 1, 0).isEmpty()).isTrue();
  }

  @Test
  @DisplayName("동액은 삽입 순서를 유지한다")
  void stableTies() {
    LeaderboardPage page =
        LeaderboardRanker.rank(totals("x", 20, "y", 20, "z", 20, "w", 40), 0, 4);

    assertThat(page.donors()).extracting(Address::value).containsExactly("w", "x", "y", "z");
  }

  @Test
  @DisplayName("음수 시작 위치는 오류 없이 빈 페이지")
  void negativeStartIsEmpty() {
    LeaderboardPage page = LeaderboardRanker.rank(totals("a", 10, "b", 20), -1, 1);

    assertThat(page.isEmpty()).isTrue();
    assertThat(page.donors()).isEmpty();
    assertThat(page.amounts()).isEmpty();
  }
}
