package crowd.ledger.infrastructure.badge;

/**
 * 후원 누적액 기준 배지 등급
 *
 * <p>임계값은 {@link InMemoryBadgeIssuer} 생성 시 주입됩니다.
 */
public enum BadgeTier {
  BRONZE,
  SILVER,
  GOLD
}
