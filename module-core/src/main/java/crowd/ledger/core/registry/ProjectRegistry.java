package crowd.ledger.core.registry;

import crowd.ledger.core.auth.Authorizer;
import crowd.ledger.core.auth.RoleAuthorizer;
import crowd.ledger.core.event.ProjectCreatedEvent;
import crowd.ledger.core.event.RegistrySettingChangedEvent;
import crowd.ledger.core.policy.FeeCalculator;
import crowd.ledger.core.port.out.BadgeIssuerPort;
import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.port.out.ProjectionPort;
import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import crowd.ledger.core.project.ProjectEscrow;
import crowd.ledger.core.project.ProjectFactory;
import crowd.ledger.core.project.RegistryLink;
import crowd.ledger.core.support.PendingEffects;
import crowd.ledger.core.support.ReentrancyGuard;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.error.exception.AlreadyInitializedException;
import crowd.ledger.error.exception.InvalidAmountException;
import crowd.ledger.error.exception.InvalidReferenceException;
import crowd.ledger.error.exception.NoRecordedDonationException;
import crowd.ledger.error.exception.PlatformPausedException;
import crowd.ledger.error.exception.TemplateMisconfiguredException;
import crowd.ledger.error.exception.UnauthorizedException;
import crowd.ledger.error.exception.UnknownProjectIdException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 플랫폼 레지스트리 / 팩토리
 *
 * <h3>책임</h3>
 *
 * <ul>
 *   <li>공유 템플릿({@link ProjectFactory})으로 프로젝트 인스턴스 생성 및 순차 ID 부여
 *   <li>전역 후원 원장과 리더보드
 *   <li>허용 자산, 수수료, 재무 계정, 일시 중지, 역할 관리
 * </ul>
 *
 * <h3>락 순서</h3>
 *
 * <p>레지스트리 → 인스턴스 방향으로만 락을 잡습니다. 인스턴스가 자기 락 안에서 호출하는 {@link RegistryLink} 조회 메서드는 레지스트리 락을 잡지
 * 않으며, 전역 원장 기록은 인스턴스 락이 풀린 뒤 부수 효과로 도착합니다.
 */
public class ProjectRegistry {

  private static final String INSTANCE_PATH = "/projects/";

  private final Address address;
  private final Authorizer authorizer;
  private final AssetAllowlist allowlist;
  private final GlobalDonationLedger globalLedger = new GlobalDonationLedger();
  private final AtomicLong donationSequence = new AtomicLong();
  private final Map<Long, ProjectEscrow> projects = new ConcurrentHashMap<>();
  private final Set<Address> knownAdmins = new LinkedHashSet<>();
  private final ProjectionPort projection;
  private final BadgeIssuerPort badgeIssuer;
  private final SecondaryEffectDispatcher dispatcher;
  private final FundingEventPublisher eventPublisher;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrancyGuard guard;

  private volatile ProjectFactory template;
  private volatile int feeBasisPoints;
  private volatile Address treasury;
  private volatile boolean paused;
  private long nextId = 1;

  private ProjectRegistry(Builder builder) {
    this.address = Address.requireActor(builder.address, "registry");
    Address platformAdmin = Address.requireActor(builder.platformAdmin, "platform admin");
    this.treasury = Address.requireActor(builder.treasury, "treasury");
    FeeCalculator.requireValidFee(builder.feeBasisPoints);
    this.feeBasisPoints = builder.feeBasisPoints;
    this.template = builder.template;
    this.projection = Objects.requireNonNull(builder.projection, "projection");
    this.badgeIssuer = Objects.requireNonNull(builder.badgeIssuer, "badgeIssuer");
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    this.eventPublisher =
        builder.eventPublisher == null ? FundingEventPublisher.noop() : builder.eventPublisher;
    this.clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
    this.authorizer = builder.authorizer == null ? new RoleAuthorizer() : builder.authorizer;
    this.allowlist = new AssetAllowlist();
    this.guard = new ReentrancyGuard(address.value());

    authorizer.grant(Role.PLATFORM_ADMIN, platformAdmin);
    authorizer.grant(Role.PROJECT_CREATOR, platformAdmin);
  }

  public static Builder builder() {
    return new Builder();
  }

  // ==================== Project Creation ====================

  /**
   * 새 프로젝트 인스턴스 생성
   *
   * <p>모든 검증은 ID를 소비하기 전에 수행되므로, 실패한 호출은 ID 순서를 건너뛰게 만들지 않습니다.
   *
   * @return 부여된 프로젝트 ID (1부터 시작)
   */
  public long createProject(Address caller, Address admin, long fundingGoal, String metadataRef) {
    return guarded(
        effects -> {
          authorizer.requireRole(Role.PROJECT_CREATOR, caller);
          if (paused) {
            throw new PlatformPausedException();
          }
          Address.requireActor(admin, "admin");
          if (fundingGoal <= 0) {
            throw new InvalidAmountException("fundingGoal=" + fundingGoal);
          }
          if (metadataRef == null || metadataRef.isBlank()) {
            throw new InvalidReferenceException("metadataRef is blank");
          }
          ProjectFactory factory = template;
          if (factory == null) {
            throw new TemplateMisconfiguredException("project template is not set");
          }

          long projectId = nextId;
          Address instanceAddress = Address.of(address.value() + INSTANCE_PATH + projectId);
          ProjectEscrow instance = factory.newInstance(instanceAddress);
          if (instance == null || !instanceAddress.equals(instance.address())) {
            throw new TemplateMisconfiguredException("template returned a foreign instance");
          }
          try {
            instance.initialize(
                new InstanceRegistryLink(this, projectId, instance),
                projectId,
                admin,
                fundingGoal,
                metadataRef);
          } catch (AlreadyInitializedException e) {
            throw new TemplateMisconfiguredException("template returned a used instance");
          }

          nextId++;
          projects.put(projectId, instance);
          knownAdmins.add(admin);

          effects.add(
              SecondaryEffect.of(
                  "Projection",
                  "projectCreated",
                  projectId,
                  () -> projection.projectCreated(projectId)));
          effects.publish(
              eventPublisher,
              new ProjectCreatedEvent(
                  projectId, instanceAddress, admin, fundingGoal, metadataRef, clock.instant()));
          return projectId;
        });
  }

  // ==================== Global Ledger ====================

  /**
   * 바인딩된 링크를 통해서만 도착하는 전역 후원 기록
   *
   * <p>링크가 가리키는 인스턴스가 projectId로 등록된 바로 그 인스턴스가 아니면 거부합니다.
   */
  void recordDonation(
      ProjectEscrow reporter, long projectId, Address donor, long amount, long sequence) {
    guarded(
        effects -> {
          ProjectEscrow instance = projects.get(projectId);
          if (instance == null) {
            throw new UnknownProjectIdException(projectId);
          }
          if (instance != reporter) {
            throw new UnauthorizedException(
                reporter == null ? "null" : reporter.address().value(),
                "project-instance:" + projectId);
          }
          Address.requireActor(donor, "donor");
          if (amount <= 0) {
            throw new InvalidAmountException("amount=" + amount);
          }
          globalLedger.record(donor, amount, sequence);
          return null;
        });
  }

  long nextDonationSequence() {
    return donationSequence.incrementAndGet();
  }

  /**
   * 전역 누적액 기준 리더보드의 [start, end) 구간
   *
   * <p>start ≥ end 또는 start ≥ 후원자 수이면 빈 페이지입니다. end는 후원자 수로 잘립니다.
   */
  public LeaderboardPage getLeaderboard(int start, int end) {
    Map<Address, Long> snapshot = read(globalLedger::snapshot);
    return LeaderboardRanker.rank(snapshot, start, end);
  }

  public long globalDonationOf(Address donor) {
    return read(() -> globalLedger.donationOf(donor));
  }

  public int totalDonors() {
    return read(globalLedger::donorCount);
  }

  public long totalDonationCount() {
    return read(globalLedger::donationCount);
  }

  public long totalFundsRaised() {
    return read(globalLedger::totalRaised);
  }

  // ==================== Badge Trigger ====================

  /**
   * 배지 발급 트리거. 금액은 해당 프로젝트에 기록된 후원자 누적액이며, 등급 분류는 발급자가 합니다.
   *
   * <p>발급자는 외부 경계이므로 레지스트리 락 밖에서 호출합니다. 발급자의 예외는 그대로 전파됩니다.
   *
   * @return 발급된 배지 ID
   */
  public String triggerBadgeMint(
      Address caller, long projectId, Address donor, String metadataRef) {
    authorizer.requireRole(Role.BADGE_OPERATOR, caller);
    Address.requireActor(donor, "donor");
    ProjectEscrow instance = project(projectId);
    long amount = instance.donationOf(donor);
    if (amount == 0) {
      throw new NoRecordedDonationException(projectId, donor.value());
    }
    return badgeIssuer.mint(donor, projectId, amount, metadataRef);
  }

  // ==================== Platform Settings ====================

  public void updateFee(Address caller, int basisPoints) {
    adminChange(
        caller,
        () -> {
          FeeCalculator.requireValidFee(basisPoints);
          feeBasisPoints = basisPoints;
          return new Setting("feeBasisPoints", basisPoints);
        });
  }

  public void updateTreasury(Address caller, Address newTreasury) {
    adminChange(
        caller,
        () -> {
          treasury = Address.requireActor(newTreasury, "treasury");
          return new Setting("treasury", newTreasury);
        });
  }

  public void pause(Address caller) {
    adminChange(
        caller,
        () -> {
          paused = true;
          return new Setting("paused", true);
        });
  }

  public void unpause(Address caller) {
    adminChange(
        caller,
        () -> {
          paused = false;
          return new Setting("paused", false);
        });
  }

  public void addAllowedAsset(Address caller, String assetId) {
    adminChange(
        caller,
        () -> {
          requireAssetId(assetId);
          allowlist.add(assetId);
          return new Setting("allowedAsset+", assetId);
        });
  }

  public void removeAllowedAsset(Address caller, String assetId) {
    adminChange(
        caller,
        () -> {
          requireAssetId(assetId);
          allowlist.remove(assetId);
          return new Setting("allowedAsset-", assetId);
        });
  }

  public void setAllowAllAssets(Address caller, boolean allowAll) {
    adminChange(
        caller,
        () -> {
          allowlist.setAllowAll(allowAll);
          return new Setting("allowAllAssets", allowAll);
        });
  }

  public void grantRole(Address caller, Role role, Address account) {
    adminChange(
        caller,
        () -> {
          authorizer.grant(Objects.requireNonNull(role, "role"), account);
          return new Setting("role+" + role, account);
        });
  }

  public void revokeRole(Address caller, Role role, Address account) {
    adminChange(
        caller,
        () -> {
          authorizer.revoke(Objects.requireNonNull(role, "role"), account);
          return new Setting("role-" + role, account);
        });
  }

  public void updateProjectTemplate(Address caller, ProjectFactory factory) {
    adminChange(
        caller,
        () -> {
          if (factory == null) {
            throw new TemplateMisconfiguredException("project template must not be null");
          }
          template = factory;
          return new Setting("projectTemplate", factory.getClass().getSimpleName());
        });
  }

  private void requireAssetId(String assetId) {
    if (assetId == null || assetId.isBlank()) {
      throw new InvalidReferenceException("assetId is blank");
    }
    if (AssetAllowlist.NATIVE_ASSET.equals(assetId)) {
      throw new InvalidReferenceException("native asset is always allowed");
    }
  }

  private void adminChange(Address caller, Supplier<Setting> change) {
    guarded(
        effects -> {
          authorizer.requireRole(Role.PLATFORM_ADMIN, caller);
          Setting setting = change.get();
          effects.publish(
              eventPublisher,
              new RegistrySettingChangedEvent(
                  setting.name(), String.valueOf(setting.value()), caller, clock.instant()));
          return null;
        });
  }

  private record Setting(String name, Object value) {}

  // ==================== Lock-free reads ====================

  public Address registryAddress() {
    return address;
  }

  public boolean isAssetAllowed(String assetId) {
    return allowlist.isAllowed(assetId);
  }

  public int feeBasisPoints() {
    return feeBasisPoints;
  }

  public Address treasury() {
    return treasury;
  }

  public boolean isPaused() {
    return paused;
  }

  public boolean isAllowAllAssets() {
    return allowlist.isAllowAll();
  }

  public Set<String> allowedAssets() {
    return allowlist.assets();
  }

  public boolean hasRole(Role role, Address account) {
    return authorizer.hasRole(role, account);
  }

  // ==================== Project Reads ====================

  public ProjectEscrow project(long projectId) {
    ProjectEscrow instance = projects.get(projectId);
    if (instance == null) {
      throw new UnknownProjectIdException(projectId);
    }
    return instance;
  }

  public Address projectAddress(long projectId) {
    return project(projectId).address();
  }

  public int projectCount() {
    return read(projects::size);
  }

  /** 등록된 프로젝트 ID (오름차순) */
  public List<Long> projectIds() {
    return read(() -> projects.keySet().stream().sorted().toList());
  }

  /** 최초 등장 순서의 프로젝트 관리자 목록 */
  public List<Address> knownAdmins() {
    return read(() -> List.copyOf(knownAdmins));
  }

  public boolean isKnownAdmin(Address account) {
    return read(() -> knownAdmins.contains(account));
  }

  // ==================== Internals ====================

  private <T> T read(Supplier<T> reader) {
    lock.lock();
    try {
      return reader.get();
    } finally {
      lock.unlock();
    }
  }

  private <T> T guarded(Function<PendingEffects, T> body) {
    PendingEffects effects = new PendingEffects(dispatcher);
    T result;
    lock.lock();
    try {
      guard.enter();
      try {
        result = body.apply(effects);
      } finally {
        guard.exit();
      }
    } finally {
      lock.unlock();
    }
    effects.flush();
    return result;
  }

  /** 레지스트리 조립용 빌더 */
  public static final class Builder {

    private Address address;
    private Address platformAdmin;
    private Address treasury;
    private int feeBasisPoints;
    private ProjectFactory template;
    private ProjectionPort projection;
    private BadgeIssuerPort badgeIssuer;
    private SecondaryEffectDispatcher dispatcher;
    private FundingEventPublisher eventPublisher;
    private Clock clock;
    private Authorizer authorizer;

    private Builder() {}

    public Builder address(Address address) {
      this.address = address;
      return this;
    }

    public Builder platformAdmin(Address platformAdmin) {
      this.platformAdmin = platformAdmin;
      return this;
    }

    public Builder treasury(Address treasury) {
      this.treasury = treasury;
      return this;
    }

    public Builder feeBasisPoints(int feeBasisPoints) {
      this.feeBasisPoints = feeBasisPoints;
      return this;
    }

    public Builder template(ProjectFactory template) {
      this.template = template;
      return this;
    }

    public Builder projection(ProjectionPort projection) {
      this.projection = projection;
      return this;
    }

    public Builder badgeIssuer(BadgeIssuerPort badgeIssuer) {
      this.badgeIssuer = badgeIssuer;
      return this;
    }

    public Builder dispatcher(SecondaryEffectDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    public Builder eventPublisher(FundingEventPublisher eventPublisher) {
      this.eventPublisher = eventPublisher;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder authorizer(Authorizer authorizer) {
      this.authorizer = authorizer;
      return this;
    }

    public ProjectRegistry build() {
      return new ProjectRegistry(this);
    }
  }
}
