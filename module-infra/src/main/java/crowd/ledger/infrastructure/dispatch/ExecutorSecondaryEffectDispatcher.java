package crowd.ledger.infrastructure.dispatch;

import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전용 스레드 풀에서 부수 효과를 실행하는 디스패처 (fire-and-forget)
 *
 * <p>풀이 작업을 거부해도 주 연산은 이미 커밋되었으므로 예외를 전파하지 않고 실패로 기록합니다. 효과들 사이의 실행 순서는 보장하지 않으며, 순서가 필요한
 * 효과는 커밋 시점에 받은 순번을 함께 싣습니다 (전역 후원 원장).
 */
@Slf4j
public class ExecutorSecondaryEffectDispatcher implements SecondaryEffectDispatcher {

  private final Executor executor;
  private final InlineSecondaryEffectDispatcher delegate;

  public ExecutorSecondaryEffectDispatcher(
      Executor executor, InlineSecondaryEffectDispatcher delegate) {
    this.executor = executor;
    this.delegate = delegate;
  }

  @Override
  public void dispatch(SecondaryEffect effect) {
    try {
      executor.execute(() -> delegate.dispatch(effect));
    } catch (RejectedExecutionException e) {
      delegate.recordFailure(effect, e);
    }
  }
}
