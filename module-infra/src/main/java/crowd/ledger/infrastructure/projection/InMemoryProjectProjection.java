package crowd.ledger.infrastructure.projection;

import crowd.ledger.core.port.out.ProjectionPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;

/** 생성된 프로젝트 ID를 기록하는 읽기 전용 프로젝션 */
@Slf4j
public class InMemoryProjectProjection implements ProjectionPort {

  private final Map<Long, Instant> projected = new ConcurrentSkipListMap<>();
  private final Clock clock;

  public InMemoryProjectProjection(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void projectCreated(long projectId) {
    projected.putIfAbsent(projectId, clock.instant());
    log.info("[Projection] project indexed: projectId={}", projectId);
  }

  public boolean contains(long projectId) {
    return projected.containsKey(projectId);
  }

  /** 프로젝트 ID 오름차순 */
  public Map<Long, Instant> snapshot() {
    return new TreeMap<>(projected);
  }
}
