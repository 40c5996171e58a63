package crowd.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.project.DefaultProjectFactory;
import crowd.ledger.core.registry.ProjectRegistry;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.project.ProjectStatus;
import crowd.ledger.domain.model.project.ProjectSummary;
import crowd.ledger.domain.model.registry.FeeSplit;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.error.exception.AssetNotAllowedException;
import crowd.ledger.error.exception.PlatformPausedException;
import crowd.ledger.error.exception.TransferFailureException;
import crowd.ledger.infrastructure.asset.InMemoryAssetDirectory;
import crowd.ledger.infrastructure.asset.InMemoryFungibleAsset;
import crowd.ledger.infrastructure.badge.BadgeTier;
import crowd.ledger.infrastructure.badge.InMemoryBadgeIssuer;
import crowd.ledger.infrastructure.dispatch.InlineSecondaryEffectDispatcher;
import crowd.ledger.infrastructure.executor.DefaultLogicExecutor;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import crowd.ledger.infrastructure.ledger.InMemoryNativeAssetLedger;
import crowd.ledger.infrastructure.projection.InMemoryProjectProjection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * 서비스 계층 통합 테스트
 *
 * <p>인메모리 어댑터와 INLINE 디스패처로 실제 레지스트리를 구성하여, 부수 효과(글로벌 기록, 프로젝션)까지 호출 직후 관찰합니다.
 */
@DisplayName("FundingService 통합 테스트")
class FundingServiceTest {

  private static final Address PLATFORM_ADMIN = Address.of("platform-admin");
  private static final Address TREASURY = Address.of("platform-treasury");
  private static final Address PROJECT_ADMIN = Address.of("project-admin");
  private static final Address OPERATOR = Address.of("badge-operator");
  private static final Address ALICE = Address.of("alice");
  private static final Address BOB = Address.of("bob");
  private static final Address CAROL = Address.of("carol");

  private SimpleMeterRegistry meterRegistry;
  private InMemoryNativeAssetLedger nativeLedger;
  private InMemoryProjectProjection projection;
  private InMemoryBadgeIssuer badgeIssuer;
  private ProjectRegistry registry;

  private FundingService fundingService;
  private RegistryAdminService adminService;
  private SandboxLedgerService ledgerService;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
    meterRegistry = new SimpleMeterRegistry();
    LogicExecutor executor = new DefaultLogicExecutor(meterRegistry);
    InlineSecondaryEffectDispatcher dispatcher =
        new InlineSecondaryEffectDispatcher(executor, meterRegistry);

    nativeLedger = new InMemoryNativeAssetLedger();
    InMemoryAssetDirectory assetDirectory = new InMemoryAssetDirectory();
    assetDirectory.register(new InMemoryFungibleAsset("USDC"));
    assetDirectory.register(new InMemoryFungibleAsset("DAI"));
    projection = new InMemoryProjectProjection(clock);
    badgeIssuer = new InMemoryBadgeIssuer(50, 100, clock);

    registry =
        ProjectRegistry.builder()
            .address(Address.of("registry-main"))
            .platformAdmin(PLATFORM_ADMIN)
            .treasury(TREASURY)
            .feeBasisPoints(250)
            .template(
                new DefaultProjectFactory(
                    nativeLedger,
                    assetDirectory,
                    dispatcher,
                    FundingEventPublisher.noop(),
                    clock))
            .projection(projection)
            .badgeIssuer(badgeIssuer)
            .dispatcher(dispatcher)
            .clock(clock)
            .build();
    registry.addAllowedAsset(PLATFORM_ADMIN, "USDC");
    registry.grantRole(PLATFORM_ADMIN, Role.BADGE_OPERATOR, OPERATOR);

    fundingService = new FundingService(registry, executor);
    adminService = new RegistryAdminService(registry, executor);
    ledgerService = new SandboxLedgerService(nativeLedger, assetDirectory, registry, executor);
  }

  private long newProject(long goal) {
    return fundingService.createProject(PLATFORM_ADMIN, PROJECT_ADMIN, goal, "meta").id();
  }

  @Nested
  @DisplayName("성공 흐름")
  class HappyPath {

    @Test
    @DisplayName("30/40/30 후원 → FUNDED → 정산 시 수수료 2, 순액 98")
    void donateFundAndRelease() {
      long projectId = newProject(100);
      ledgerService.deposit(ALICE, 30);
      ledgerService.deposit(BOB, 40);
      ledgerService.deposit(CAROL, 30);

      fundingService.donate(ALICE, projectId, null, 30);
      fundingService.donate(BOB, projectId, null, 40);
      ProjectSummary funded = fundingService.donate(CAROL, projectId, null, 30);

      assertThat(funded.status()).isEqualTo(ProjectStatus.FUNDED);
      assertThat(funded.donorCount()).isEqualTo(3);

      FeeSplit split = fundingService.releaseFunds(PROJECT_ADMIN, projectId);

      assertThat(split).isEqualTo(new FeeSplit(2, 98));
      assertThat(nativeLedger.balanceOf(TREASURY)).isEqualTo(2);
      assertThat(nativeLedger.balanceOf(PROJECT_ADMIN)).isEqualTo(98);
      assertThat(fundingService.getProject(projectId).status()).isEqualTo(ProjectStatus.COMPLETED);
    }

    @Test
    @DisplayName("INLINE 디스패처에서는 글로벌 리더보드와 프로젝션이 즉시 반영된다")
    void secondaryEffectsAreVisibleInline() {
      long first = newProject(1_000);
      long second = newProject(1_000);
      ledgerService.deposit(ALICE, 100);
      ledgerService.deposit(BOB, 100);

      fundingService.donate(ALICE, first, null, 20);
      fundingService.donate(BOB, first, null, 50);
      fundingService.donate(ALICE, second, null, 40);

      LeaderboardPage page = fundingService.leaderboard(0, 10);
      assertThat(page.donors()).containsExactly(ALICE, BOB);
      assertThat(page.amounts()).containsExactly(60L, 50L);
      assertThat(fundingService.globalDonationOf(ALICE)).isEqualTo(60);
      assertThat(projection.contains(first)).isTrue();
      assertThat(projection.contains(second)).isTrue();
      assertThat(adminService.snapshot().totalDonationCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("allowance를 설정한 토큰 후원은 기록되지만 네이티브 기여분에는 포함되지 않는다")
    void tokenDonation() {
      long projectId = newProject(100);
      ledgerService.mint("USDC", ALICE, 500);
      ledgerService.approve("USDC", ALICE, projectId, 70);

      fundingService.donate(ALICE, projectId, "USDC", 70);

      assertThat(fundingService.donationOf(projectId, ALICE)).isEqualTo(70);
      assertThat(fundingService.nativeContributionOf(projectId, ALICE)).isZero();
      assertThat(ledgerService.balanceOf("USDC", ALICE)).isEqualTo(430);
    }

    @Test
    @DisplayName("배지는 프로젝트 누적액 기준 등급으로 발급된다")
    void badgeMint() {
      long projectId = newProject(1_000);
      ledgerService.deposit(ALICE, 200);
      fundingService.donate(ALICE, projectId, null, 120);

      String badgeId = adminService.triggerBadgeMint(OPERATOR, projectId, ALICE, "badge-meta");

      assertThat(badgeId).isNotBlank();
      assertThat(badgeIssuer.badgesOf(ALICE))
          .singleElement()
          .satisfies(
              badge -> {
                assertThat(badge.tier()).isEqualTo(BadgeTier.GOLD);
                assertThat(badge.amount()).isEqualTo(120);
              });
    }

    @Test
    @DisplayName("취소 후 전체 환불은 네이티브 잔액을 돌려준다")
    void cancelAndRefundAll() {
      long projectId = newProject(1_000);
      ledgerService.deposit(ALICE, 100);
      ledgerService.deposit(BOB, 100);
      fundingService.donate(ALICE, projectId, null, 30);
      fundingService.donate(BOB, projectId, null, 45);

      fundingService.cancel(PROJECT_ADMIN, projectId);
      long refunded = fundingService.refundAllDonors(PROJECT_ADMIN, projectId);

      assertThat(refunded).isEqualTo(75);
      assertThat(nativeLedger.balanceOf(ALICE)).isEqualTo(100);
      assertThat(nativeLedger.balanceOf(BOB)).isEqualTo(100);
      assertThat(fundingService.getProject(projectId).fundsRaised()).isZero();
    }
  }

  @Nested
  @DisplayName("실패 흐름")
  class Failures {

    @Test
    @DisplayName("비즈니스 예외는 LogicExecutor를 거쳐도 변환되지 않는다")
    void businessExceptionPassesThrough() {
      adminService.pause(PLATFORM_ADMIN);

      assertThatThrownBy(() -> newProject(100)).isInstanceOf(PlatformPausedException.class);
      assertThat(
              meterRegistry
                  .find("logic.executor")
                  .tags("operation", "createProject", "result", "failure")
                  .timer())
          .isNotNull();
    }

    @Test
    @DisplayName("잔액이 부족한 후원은 이체 실패이며 아무것도 기록되지 않는다")
    void insufficientBalance() {
      long projectId = newProject(100);
      ledgerService.deposit(ALICE, 5);

      assertThatThrownBy(() -> fundingService.donate(ALICE, projectId, null, 50))
          .isInstanceOf(TransferFailureException.class);
      assertThat(fundingService.getProject(projectId).fundsRaised()).isZero();
      assertThat(fundingService.leaderboard(0, 10).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("디렉터리에 없는 토큰 발행은 거부된다")
    void mintUnknownAsset() {
      assertThatThrownBy(() -> ledgerService.mint("WBTC", ALICE, 10))
          .isInstanceOf(AssetNotAllowedException.class);
    }

    @Test
    @DisplayName("허용 목록에 없는 토큰 후원은 거부된다")
    void donateDisallowedToken() {
      long projectId = newProject(100);
      ledgerService.mint("DAI", ALICE, 100);
      ledgerService.approve("DAI", ALICE, projectId, 100);

      assertThatThrownBy(() -> fundingService.donate(ALICE, projectId, "DAI", 50))
          .isInstanceOf(AssetNotAllowedException.class);
      assertThat(ledgerService.balanceOf("DAI", ALICE)).isEqualTo(100);
    }
  }
}
