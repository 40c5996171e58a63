package crowd.ledger.core.port.out;

import crowd.ledger.domain.model.account.Address;

/**
 * 허용 목록에 등록되는 대체 가능 자산(fungible asset)의 이체 인터페이스
 *
 * <p>이체 호출은 임의의 부수 효과를 가질 수 있는 외부 경계입니다(재진입 가능 지점). 결과가 {@code false}이면 호출 전체가 실패해야 합니다.
 */
public interface AssetTransferPort {

  String assetId();

  long balanceOf(Address account);

  /**
   * spender가 from의 승인 한도 내에서 to로 이체합니다.
   *
   * @return 이체 성공 여부
   */
  boolean transferFrom(Address spender, Address from, Address to, long amount);

  /**
   * sender 자신의 잔액에서 to로 이체합니다.
   *
   * @return 이체 성공 여부
   */
  boolean transfer(Address sender, Address to, long amount);
}
