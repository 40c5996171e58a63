package crowd.ledger.infrastructure.executor;

import crowd.ledger.common.function.ThrowingRunnable;
import crowd.ledger.common.function.ThrowingSupplier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 기본 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>BaseException pass-through</b>: 비즈니스 예외는 그대로 전파
 *   <li><b>메트릭</b>: {@code logic.executor} Timer (component / operation / result 태그)
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator translator;

  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    long start = System.nanoTime();
    try {
      T result = task.get();
      record(context, "success", start);
      return result;
    } catch (Error e) {
      record(context, "error", start);
      throw e;
    } catch (Throwable t) {
      record(context, "failure", start);
      RuntimeException primary = translator.translate(t, context);
      log.debug(
          "[Task:FAILURE] {}, errorType={}",
          context.toTaskName(),
          primary.getClass().getSimpleName());
      throw primary;
    }
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return execute(task, context);
    } catch (RuntimeException e) {
      return recovery.apply(e);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  private void record(TaskContext context, String result, long startNanos) {
    Timer.builder(METRIC_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("result", result)
        .register(meterRegistry)
        .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
  }
}
