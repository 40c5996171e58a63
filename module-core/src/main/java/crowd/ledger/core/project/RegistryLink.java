package crowd.ledger.core.project;

import crowd.ledger.domain.model.account.Address;

/**
 * 프로젝트 인스턴스가 바라보는 레지스트리의 좁은 인터페이스
 *
 * <p>레지스트리는 프로젝트를 만들 때 인스턴스마다 전용 링크를 하나씩 발급합니다. 링크 자체가 권한이므로 전역 원장 기록에 호출자 인자가 없습니다.
 *
 * <p>조회 메서드는 인스턴스 락을 잡은 상태에서 호출되므로 레지스트리 락을 요구하지 않아야 합니다.
 */
public interface RegistryLink {

  Address registryAddress();

  boolean isAssetAllowed(String assetId);

  int feeBasisPoints();

  Address treasury();

  /** 전역 후원 순번 발급. 인스턴스 락 안, 후원 커밋 시점에 호출합니다. */
  long nextDonationSequence();

  /**
   * 링크에 바인딩된 프로젝트 이름으로 전역 후원 원장에 기록합니다.
   *
   * @param sequence {@link #nextDonationSequence()}로 받은 커밋 순번
   */
  void recordDonation(Address donor, long amount, long sequence);
}
