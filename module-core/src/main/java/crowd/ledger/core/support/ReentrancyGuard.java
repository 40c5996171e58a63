package crowd.ledger.core.support;

import crowd.ledger.error.exception.ReentrantCallException;

/**
 * 인스턴스 단위 재진입 가드
 *
 * <p>외부 자산 이체 호출은 임의의 콜백을 실행할 수 있으므로, 바깥 호출이 끝나기 전에 같은 인스턴스의 변경 연산이 다시 들어오면 거부합니다. 가드는
 * 인스턴스마다 하나이며 전역으로 공유되지 않습니다. 항상 소유자의 락 안에서 사용됩니다.
 */
public final class ReentrancyGuard {

  private final String target;
  private boolean entered;

  public ReentrancyGuard(String target) {
    this.target = target;
  }

  public void enter() {
    if (entered) {
      throw new ReentrantCallException(target);
    }
    entered = true;
  }

  public void exit() {
    entered = false;
  }
}
