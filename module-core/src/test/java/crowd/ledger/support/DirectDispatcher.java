package crowd.ledger.support;

import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.List;

/** 부수 효과를 즉시 실행하고, 실패는 기록만 하는 테스트 디스패처 */
public class DirectDispatcher implements SecondaryEffectDispatcher {

  private final List<SecondaryEffect> dispatched = new CopyOnWriteArrayList<>();
  private final List<RuntimeException> failures = new CopyOnWriteArrayList<>();

  @Override
  public void dispatch(SecondaryEffect effect) {
    dispatched.add(effect);
    try {
      effect.action().run();
    } catch (RuntimeException e) {
      failures.add(e);
    }
  }

  public List<SecondaryEffect> dispatched() {
    return dispatched;
  }

  public List<RuntimeException> failures() {
    return failures;
  }
}
