package crowd.ledger.infrastructure.config;

import crowd.ledger.infrastructure.dispatch.InlineSecondaryEffectDispatcher;
import crowd.ledger.infrastructure.executor.DefaultLogicExecutor;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * 인프라 모듈 공통 빈 자동 구성
 *
 * <ul>
 *   <li>{@link LogicExecutor}: {@code funding.infra.executor.enabled=false}로 비활성화
 *   <li>{@link InlineSecondaryEffectDispatcher}: 비동기 디스패처의 실행 위임 대상
 * </ul>
 *
 * <p>MeterRegistry 빈이 없으면 SimpleMeterRegistry로 대체합니다.
 */
@AutoConfiguration
@ConditionalOnProperty(
    prefix = "funding.infra.executor",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class FundingInfraAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor(ObjectProvider<MeterRegistry> meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public InlineSecondaryEffectDispatcher inlineSecondaryEffectDispatcher(
      LogicExecutor logicExecutor, ObjectProvider<MeterRegistry> meterRegistry) {
    return new InlineSecondaryEffectDispatcher(
        logicExecutor, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }
}
