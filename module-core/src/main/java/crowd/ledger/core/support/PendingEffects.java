package crowd.ledger.core.support;

import crowd.ledger.core.event.FundingEvent;
import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * 한 호출 동안 쌓인 부수 효과 버퍼
 *
 * <p>주 연산이 성공적으로 커밋되고 락이 해제된 뒤에만 {@link #flush()}됩니다. 실패한 호출의 버퍼는 그대로 버려지므로, 실패한 연산은 어떤 알림도
 * 남기지 않습니다.
 */
public final class PendingEffects {

  private final SecondaryEffectDispatcher dispatcher;
  private final List<SecondaryEffect> effects = new ArrayList<>();

  public PendingEffects(SecondaryEffectDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  public void add(SecondaryEffect effect) {
    effects.add(effect);
  }

  public void publish(FundingEventPublisher publisher, FundingEvent event) {
    effects.add(
        SecondaryEffect.of(
            "Events", "publish", event.getClass().getSimpleName(), () -> publisher.publish(event)));
  }

  public void flush() {
    for (SecondaryEffect effect : effects) {
      dispatcher.dispatch(effect);
    }
    effects.clear();
  }
}
