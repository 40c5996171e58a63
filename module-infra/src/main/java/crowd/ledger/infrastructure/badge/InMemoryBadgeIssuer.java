package crowd.ledger.infrastructure.badge;

import crowd.ledger.core.port.out.BadgeIssuerPort;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.error.exception.InvalidAmountException;
import crowd.ledger.error.exception.InvalidReferenceException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 배지 발급자
 *
 * <p>등급 분류는 이 어댑터의 책임입니다: {@code amount >= goldThreshold} → GOLD, {@code >= silverThreshold} → SILVER,
 * 그 외 BRONZE. 같은 (후원자, 프로젝트)에 대한 재요청은 기존 배지를 갱신합니다.
 */
@Slf4j
public class InMemoryBadgeIssuer implements BadgeIssuerPort {

  private final long silverThreshold;
  private final long goldThreshold;
  private final Clock clock;
  private final AtomicLong sequence = new AtomicLong();
  private final Map<String, BadgeRecord> badges = new ConcurrentHashMap<>();

  public InMemoryBadgeIssuer(long silverThreshold, long goldThreshold, Clock clock) {
    if (silverThreshold <= 0 || goldThreshold <= silverThreshold) {
      throw new InvalidAmountException(
          "badge thresholds silver=" + silverThreshold + ", gold=" + goldThreshold);
    }
    this.silverThreshold = silverThreshold;
    this.goldThreshold = goldThreshold;
    this.clock = clock;
  }

  @Override
  public String mint(Address donor, long projectId, long amount, String metadataRef) {
    if (metadataRef == null || metadataRef.isBlank()) {
      throw new InvalidReferenceException("badge metadataRef is blank");
    }
    String key = projectId + ":" + donor.value();
    BadgeRecord record =
        badges.compute(
            key,
            (k, existing) ->
                new BadgeRecord(
                    existing == null ? "badge-" + sequence.incrementAndGet() : existing.badgeId(),
                    donor,
                    projectId,
                    amount,
                    classify(amount),
                    metadataRef,
                    clock.instant()));
    log.info(
        "[Badge] minted: badgeId={}, donor={}, projectId={}, tier={}",
        record.badgeId(),
        donor,
        projectId,
        record.tier());
    return record.badgeId();
  }

  public BadgeTier classify(long amount) {
    if (amount >= goldThreshold) {
      return BadgeTier.GOLD;
    }
    if (amount >= silverThreshold) {
      return BadgeTier.SILVER;
    }
    return BadgeTier.BRONZE;
  }

  public List<BadgeRecord> badgesOf(Address donor) {
    return badges.values().stream()
        .filter(b -> b.donor().equals(donor))
        .sorted((a, b) -> Long.compare(a.projectId(), b.projectId()))
        .toList();
  }
}
