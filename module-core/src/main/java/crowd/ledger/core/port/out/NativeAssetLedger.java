package crowd.ledger.core.port.out;

import crowd.ledger.domain.model.account.Address;
import java.util.List;

/**
 * 플랫폼 기본 자산(native asset) 원장 포트
 *
 * <p>에스크로 잔액은 인스턴스 주소의 잔액으로 표현됩니다. 모든 이체는 결과를 반환하며, 호출자는 {@code false}를 절대 성공으로 취급하지 않습니다.
 */
public interface NativeAssetLedger {

  long balanceOf(Address account);

  /**
   * 단일 이체
   *
   * @return 이체 성공 여부 (잔액 부족 등 실패 시 아무것도 변경되지 않아야 함)
   */
  boolean transfer(Address from, Address to, long amount);

  /**
   * 일괄 이체 (all-or-nothing)
   *
   * <p>하나라도 실패하면 어떤 이체도 반영되지 않아야 합니다. 정산(수수료 + 순수익)과 일괄 환불이 이 계약에 의존합니다.
   *
   * @param from 출금 계정
   * @param transfers 수취인별 이체 목록
   * @return 전체 성공 여부
   */
  boolean transferAll(Address from, List<Transfer> transfers);

  /** 일괄 이체의 한 항목 */
  record Transfer(Address to, long amount) {}
}
