package crowd.ledger.controller.dto.registry;

import crowd.ledger.domain.model.registry.LeaderboardPage;
import java.util.ArrayList;
import java.util.List;

/**
 * 리더보드 구간 응답
 *
 * @param start 요청한 시작 순위 (0부터)
 * @param entries rank는 1부터 시작하는 전체 순위
 */
public record LeaderboardResponse(int start, List<Entry> entries) {

  public static LeaderboardResponse of(int start, LeaderboardPage page) {
    List<Entry> entries = new ArrayList<>(page.size());
    for (int i = 0; i < page.size(); i++) {
      entries.add(new Entry(start + i + 1, page.donors().get(i).value(), page.amounts().get(i)));
    }
    return new LeaderboardResponse(start, entries);
  }

  public record Entry(int rank, String donor, long amount) {}
}
