package crowd.ledger.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 부수 효과 전용 Thread Pool 설정
 *
 * <h4>운영 정책</h4>
 *
 * <ul>
 *   <li><b>commonPool 분리</b>: 프로젝션/이벤트 지연이 요청 스레드로 전파되지 않음
 *   <li><b>RejectedExecution</b>: AbortPolicy + 샘플링 로깅 + rejected 메트릭. 디스패처가 거부를 실패로 기록
 *   <li><b>Shutdown</b>: 대기 중인 부수 효과를 모두 처리한 뒤 종료
 * </ul>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "funding.secondary", name = "mode", havingValue = "async",
    matchIfMissing = true)
public class ExecutorConfig {

  static final String EXECUTOR_NAME = "secondary-effect";
  private static final long REJECT_LOG_SAMPLE = 100;

  @Bean(name = "secondaryEffectExecutor")
  public Executor secondaryEffectExecutor(
      FundingProperties properties, MeterRegistry meterRegistry) {
    FundingProperties.Secondary pool = properties.secondary();

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.corePoolSize());
    executor.setMaxPoolSize(Math.max(pool.corePoolSize(), pool.maxPoolSize()));
    executor.setQueueCapacity(pool.queueCapacity());
    executor.setThreadNamePrefix(EXECUTOR_NAME + "-");
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setRejectedExecutionHandler(abortWithMetrics(meterRegistry));
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), EXECUTOR_NAME, Collections.emptyList())
        .bindTo(meterRegistry);
    return executor;
  }

  private RejectedExecutionHandler abortWithMetrics(MeterRegistry meterRegistry) {
    Counter rejected =
        Counter.builder("executor.rejected")
            .tag("name", EXECUTOR_NAME)
            .description("Number of tasks rejected by the secondary effect executor")
            .register(meterRegistry);
    AtomicLong rejectedCount = new AtomicLong();

    return (task, pool) -> {
      rejected.increment();
      long count = rejectedCount.incrementAndGet();
      if (count == 1 || count % REJECT_LOG_SAMPLE == 0) {
        log.warn(
            "[SecondaryEffectExecutor] Task rejected (total={}, active={}, queued={})",
            count,
            pool.getActiveCount(),
            pool.getQueue().size());
      }
      throw new RejectedExecutionException("secondary effect executor saturated");
    };
  }
}
