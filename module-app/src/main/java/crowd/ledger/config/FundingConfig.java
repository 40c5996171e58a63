package crowd.ledger.config;

import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import crowd.ledger.core.project.DefaultProjectFactory;
import crowd.ledger.core.registry.ProjectRegistry;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.event.SpringFundingEventPublisher;
import crowd.ledger.infrastructure.asset.InMemoryAssetDirectory;
import crowd.ledger.infrastructure.asset.InMemoryFungibleAsset;
import crowd.ledger.infrastructure.badge.InMemoryBadgeIssuer;
import crowd.ledger.infrastructure.dispatch.ExecutorSecondaryEffectDispatcher;
import crowd.ledger.infrastructure.dispatch.InlineSecondaryEffectDispatcher;
import crowd.ledger.infrastructure.ledger.InMemoryNativeAssetLedger;
import crowd.ledger.infrastructure.projection.InMemoryProjectProjection;
import java.time.Clock;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 펀딩 레지스트리 빈 구성
 *
 * <h4>구성 순서</h4>
 *
 * <ol>
 *   <li>원장/자산 디렉터리/프로젝션/배지 발급기 (인메모리 어댑터)
 *   <li>부수 효과 디스패처 (INLINE 또는 전용 풀)
 *   <li>프로젝트 템플릿 → 레지스트리
 *   <li>허용 자산, 역할 부여 (플랫폼 관리자 권한으로 적용)
 * </ol>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FundingProperties.class)
public class FundingConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public InMemoryNativeAssetLedger nativeAssetLedger() {
    return new InMemoryNativeAssetLedger();
  }

  @Bean
  public InMemoryAssetDirectory assetDirectory(FundingProperties properties) {
    InMemoryAssetDirectory directory = new InMemoryAssetDirectory();
    properties.assets().forEach(assetId -> directory.register(new InMemoryFungibleAsset(assetId)));
    return directory;
  }

  @Bean
  public InMemoryProjectProjection projectProjection(Clock clock) {
    return new InMemoryProjectProjection(clock);
  }

  @Bean
  public InMemoryBadgeIssuer badgeIssuer(FundingProperties properties, Clock clock) {
    FundingProperties.Badge badge = properties.badge();
    return new InMemoryBadgeIssuer(badge.silverThreshold(), badge.goldThreshold(), clock);
  }

  @Bean
  public FundingEventPublisher fundingEventPublisher(
      ApplicationEventPublisher applicationEventPublisher) {
    return new SpringFundingEventPublisher(applicationEventPublisher);
  }

  /** ASYNC면 secondaryEffectExecutor에 위임하고, 풀이 없거나 INLINE이면 호출 스레드에서 실행합니다. */
  @Bean
  @Primary
  public SecondaryEffectDispatcher secondaryEffectDispatcher(
      FundingProperties properties,
      InlineSecondaryEffectDispatcher inlineDispatcher,
      @Qualifier("secondaryEffectExecutor") ObjectProvider<Executor> secondaryEffectExecutor) {
    Executor executor = secondaryEffectExecutor.getIfAvailable();
    if (properties.secondary().mode() == FundingProperties.DispatchMode.INLINE
        || executor == null) {
      log.info("[FundingConfig] Secondary effects run inline");
      return inlineDispatcher;
    }
    log.info("[FundingConfig] Secondary effects run on secondaryEffectExecutor");
    return new ExecutorSecondaryEffectDispatcher(executor, inlineDispatcher);
  }

  @Bean
  public DefaultProjectFactory projectTemplate(
      InMemoryNativeAssetLedger nativeAssetLedger,
      InMemoryAssetDirectory assetDirectory,
      SecondaryEffectDispatcher secondaryEffectDispatcher,
      FundingEventPublisher fundingEventPublisher,
      Clock clock) {
    return new DefaultProjectFactory(
        nativeAssetLedger, assetDirectory, secondaryEffectDispatcher, fundingEventPublisher, clock);
  }

  @Bean
  public ProjectRegistry projectRegistry(
      FundingProperties properties,
      DefaultProjectFactory projectTemplate,
      InMemoryProjectProjection projectProjection,
      InMemoryBadgeIssuer badgeIssuer,
      SecondaryEffectDispatcher secondaryEffectDispatcher,
      FundingEventPublisher fundingEventPublisher,
      Clock clock) {
    Address platformAdmin = Address.of(properties.platformAdmin());
    ProjectRegistry registry =
        ProjectRegistry.builder()
            .address(Address.of(properties.registryAddress()))
            .platformAdmin(platformAdmin)
            .treasury(Address.of(properties.treasury()))
            .feeBasisPoints(properties.feeBasisPoints())
            .template(projectTemplate)
            .projection(projectProjection)
            .badgeIssuer(badgeIssuer)
            .dispatcher(secondaryEffectDispatcher)
            .eventPublisher(fundingEventPublisher)
            .clock(clock)
            .build();

    properties.allowedAssets().forEach(assetId -> registry.addAllowedAsset(platformAdmin, assetId));
    if (properties.allowAllAssets()) {
      registry.setAllowAllAssets(platformAdmin, true);
    }
    for (String account : properties.projectCreators()) {
      registry.grantRole(platformAdmin, Role.PROJECT_CREATOR, Address.of(account));
    }
    for (String account : properties.badgeOperators()) {
      registry.grantRole(platformAdmin, Role.BADGE_OPERATOR, Address.of(account));
    }

    log.info(
        "[FundingConfig] Registry ready: address={}, feeBps={}, treasury={}, allowedAssets={}",
        registry.registryAddress(),
        registry.feeBasisPoints(),
        registry.treasury(),
        registry.allowedAssets());
    return registry;
  }
}
