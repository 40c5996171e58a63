package crowd.ledger.core.port.out;

/**
 * 부수 효과 디스패처 (fire-and-forget)
 *
 * <h3>계약</h3>
 *
 * <ul>
 *   <li>dispatch는 예외를 호출자에게 전파하지 않습니다. 실패는 구현체가 기록하고 버립니다.
 *   <li>주 연산은 부수 효과의 완료를 기다리지 않습니다 (동기 구현도 결과를 돌려주지 않음).
 * </ul>
 */
@FunctionalInterface
public interface SecondaryEffectDispatcher {

  void dispatch(SecondaryEffect effect);
}
