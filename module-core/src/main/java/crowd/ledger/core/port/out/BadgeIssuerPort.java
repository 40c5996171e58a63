package crowd.ledger.core.port.out;

import crowd.ledger.domain.model.account.Address;

/**
 * 리워드/배지 발급자
 *
 * <p>후원 누적액으로부터 등급(tier)을 분류하는 책임은 전적으로 발급자에게 있습니다. 코어는 발급 트리거만 제공합니다.
 */
public interface BadgeIssuerPort {

  /**
   * @param donor 후원자
   * @param projectId 대상 프로젝트
   * @param amount 해당 프로젝트에 기록된 후원자 누적액
   * @param metadataRef 코어 밖에서 준비된 메타데이터 참조
   * @return 발급된 배지 ID
   */
  String mint(Address donor, long projectId, long amount, String metadataRef);
}
