package crowd.ledger.infrastructure.dispatch;

import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import crowd.ledger.infrastructure.executor.TaskContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * 호출 스레드에서 부수 효과를 즉시 실행하는 디스패처
 *
 * <p>실패는 로그와 {@code funding.secondary.failures} 카운터로만 남고 호출자에게 전파되지 않습니다. 주 연산은 이미 커밋된 상태입니다.
 */
@Slf4j
public class InlineSecondaryEffectDispatcher implements SecondaryEffectDispatcher {

  static final String FAILURE_METRIC = "funding.secondary.failures";

  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  public InlineSecondaryEffectDispatcher(LogicExecutor executor, MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void dispatch(SecondaryEffect effect) {
    TaskContext context =
        TaskContext.of("Secondary", effect.component() + "." + effect.operation(), effect.detail());
    executor.executeOrCatch(
        () -> {
          effect.action().run();
          return Boolean.TRUE;
        },
        e -> {
          recordFailure(effect, e);
          return Boolean.FALSE;
        },
        context);
  }

  void recordFailure(SecondaryEffect effect, Throwable cause) {
    failureCounter(effect).increment();
    log.warn(
        "[SecondaryEffect] dropped: component={}, operation={}, detail={}, cause={}",
        effect.component(),
        effect.operation(),
        effect.detail(),
        cause.getMessage());
  }

  private Counter failureCounter(SecondaryEffect effect) {
    return Counter.builder(FAILURE_METRIC)
        .tag("component", effect.component())
        .tag("operation", effect.operation())
        .register(meterRegistry);
  }
}
