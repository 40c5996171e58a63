package crowd.ledger.core.project;

import crowd.ledger.core.event.DonationReceivedEvent;
import crowd.ledger.core.event.DonorRefundedEvent;
import crowd.ledger.core.event.EvidenceSubmittedEvent;
import crowd.ledger.core.event.FundsReleasedEvent;
import crowd.ledger.core.event.ProjectStatusChangedEvent;
import crowd.ledger.core.policy.FeeCalculator;
import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.core.port.out.AssetDirectory;
import crowd.ledger.core.port.out.AssetTransferPort;
import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.port.out.NativeAssetLedger;
import crowd.ledger.core.port.out.NativeAssetLedger.Transfer;
import crowd.ledger.core.port.out.SecondaryEffect;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import crowd.ledger.core.registry.AssetAllowlist;
import crowd.ledger.core.support.PendingEffects;
import crowd.ledger.core.support.ReentrancyGuard;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.project.EvidenceRecord;
import crowd.ledger.domain.model.project.ProjectStatus;
import crowd.ledger.domain.model.project.ProjectSummary;
import crowd.ledger.domain.model.registry.FeeSplit;
import crowd.ledger.error.exception.AlreadyInitializedException;
import crowd.ledger.error.exception.AlreadyReleasedException;
import crowd.ledger.error.exception.AssetNotAllowedException;
import crowd.ledger.error.exception.EvidenceNotFoundException;
import crowd.ledger.error.exception.GoalNotReachedException;
import crowd.ledger.error.exception.InvalidAmountException;
import crowd.ledger.error.exception.InvalidIdentityException;
import crowd.ledger.error.exception.InvalidReferenceException;
import crowd.ledger.error.exception.InvalidStatusTransitionException;
import crowd.ledger.error.exception.NoRecordedDonationException;
import crowd.ledger.error.exception.NotInitializedException;
import crowd.ledger.error.exception.ProjectNotActiveException;
import crowd.ledger.error.exception.TransferFailureException;
import crowd.ledger.error.exception.UnauthorizedException;
import crowd.ledger.error.exception.base.BaseException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 프로젝트 에스크로 엔진 (후원 / 보관 / 정산 / 환불 상태 머신)
 *
 * <h3>실행 모델</h3>
 *
 * <ul>
 *   <li>모든 변경 연산은 인스턴스 락 아래에서 직렬화되며 재진입 가드를 잡습니다.
 *   <li>검증 → (단일 이체 또는 all-or-nothing 일괄 이체) → 메모리 상태 반영 순서로 진행합니다. 반영 단계는 실패하지 않으므로 실패한 호출은
 *       부분 변경을 남기지 않습니다.
 *   <li>전역 원장 기록과 이벤트 발행은 커밋 및 락 해제 이후 {@link SecondaryEffectDispatcher}로 넘깁니다.
 * </ul>
 *
 * <p>인스턴스는 {@link ProjectFactory}가 만들고, 레지스트리가 {@link #initialize}로 정확히 한 번 초기화합니다.
 */
public final class ProjectEscrow {

  private static final String PROJECT_ADMIN = "project-admin";

  private final Address address;
  private final NativeAssetLedger nativeLedger;
  private final AssetDirectory assetDirectory;
  private final SecondaryEffectDispatcher dispatcher;
  private final FundingEventPublisher eventPublisher;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrancyGuard guard;
  private final DonationLedger ledger = new DonationLedger();
  private final List<EvidenceRecord> evidence = new ArrayList<>();

  private boolean initialized;
  private RegistryLink registry;
  private long id;
  private Address admin;
  private long goal;
  private long fundsRaised;
  private ProjectStatus status;
  private String metadataRef;

  public ProjectEscrow(
      Address address,
      NativeAssetLedger nativeLedger,
      AssetDirectory assetDirectory,
      SecondaryEffectDispatcher dispatcher,
      FundingEventPublisher eventPublisher,
      Clock clock) {
    this.address = Address.requireActor(address, "project instance");
    this.nativeLedger = Objects.requireNonNull(nativeLedger, "nativeLedger");
    this.assetDirectory = Objects.requireNonNull(assetDirectory, "assetDirectory");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.guard = new ReentrancyGuard(address.value());
  }

  public Address address() {
    return address;
  }

  // ==================== Initialization ====================

  /**
   * 1회성 초기화. 호출한 레지스트리를 신뢰 대상으로 바인딩합니다.
   *
   * <p>두 번째 호출은 인자와 무관하게 항상 {@link AlreadyInitializedException}입니다.
   */
  public void initialize(
      RegistryLink registry, long projectId, Address admin, long goal, String metadataRef) {
    guarded(
        effects -> {
          if (initialized) {
            throw new AlreadyInitializedException(this.id);
          }
          if (registry == null) {
            throw new InvalidIdentityException("registry must be bound");
          }
          if (projectId <= 0) {
            throw new InvalidReferenceException("projectId=" + projectId);
          }
          Address.requireActor(admin, "admin");
          if (goal <= 0) {
            throw new InvalidAmountException("goal=" + goal);
          }
          if (metadataRef == null || metadataRef.isBlank()) {
            throw new InvalidReferenceException("metadataRef is blank");
          }
          this.registry = registry;
          this.id = projectId;
          this.admin = admin;
          this.goal = goal;
          this.metadataRef = metadataRef;
          this.status = ProjectStatus.ACTIVE;
          this.initialized = true;
          return null;
        });
  }

  // ==================== Donations ====================

  /** 기본 자산 후원 */
  public void donate(Address donor, long amount) {
    guarded(
        effects -> {
          requireAcceptingDonations(donor, amount);
          ledger.checkCredit(donor, AssetAllowlist.NATIVE_ASSET, amount);
          long raisedAfter = FundingRules.addChecked(fundsRaised, amount, "fundsRaised");

          pullNative(donor, amount);
          commitDonation(donor, AssetAllowlist.NATIVE_ASSET, amount, raisedAfter, effects);
          return null;
        });
  }

  /** 인스턴스로 직접 들어온 기본 자산 이체는 익명 후원으로 처리합니다. */
  public void onNativeTransfer(Address sender, long amount) {
    donate(sender, amount);
  }

  /**
   * 허용 자산 후원
   *
   * <p>자산 이체는 외부 호출이며 재진입 가능 지점입니다. 이체 결과가 false이거나 예외가 발생하면 호출 전체가 실패하고 아무것도 기록되지 않습니다.
   */
  public void donateToken(Address donor, String assetId, long amount) {
    guarded(
        effects -> {
          requireAcceptingDonations(donor, amount);
          if (assetId == null || assetId.isBlank()) {
            throw new InvalidReferenceException("assetId is blank");
          }
          if (AssetAllowlist.NATIVE_ASSET.equals(assetId)) {
            throw new InvalidReferenceException("native asset must be donated via donate()");
          }
          if (!registry.isAssetAllowed(assetId)) {
            throw new AssetNotAllowedException(assetId);
          }
          AssetTransferPort asset =
              assetDirectory.find(assetId).orElseThrow(() -> new AssetNotAllowedException(assetId));
          ledger.checkCredit(donor, assetId, amount);
          long raisedAfter = FundingRules.addChecked(fundsRaised, amount, "fundsRaised");

          pullToken(asset, donor, amount);
          commitDonation(donor, assetId, amount, raisedAfter, effects);
          return null;
        });
  }

  private void requireAcceptingDonations(Address donor, long amount) {
    requireInitialized();
    if (status != ProjectStatus.ACTIVE) {
      throw new ProjectNotActiveException(id, status.name());
    }
    FundingRules.requireDonationAmount(amount);
    Address.requireActor(donor, "donor");
  }

  private void pullNative(Address donor, long amount) {
    boolean transferred;
    try {
      transferred = nativeLedger.transfer(donor, address, amount);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TransferFailureException("native deposit from " + donor, e);
    }
    if (!transferred) {
      throw new TransferFailureException("native deposit from " + donor);
    }
  }

  private void pullToken(AssetTransferPort asset, Address donor, long amount) {
    boolean transferred;
    try {
      transferred = asset.transferFrom(address, donor, address, amount);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TransferFailureException(asset.assetId() + " transferFrom " + donor, e);
    }
    if (!transferred) {
      throw new TransferFailureException(asset.assetId() + " transferFrom " + donor);
    }
  }

  private void commitDonation(
      Address donor, String assetId, long amount, long raisedAfter, PendingEffects effects) {
    ledger.credit(donor, assetId, amount);
    fundsRaised = raisedAfter;

    RegistryLink link = registry;
    long sequence = link.nextDonationSequence();
    effects.add(
        SecondaryEffect.of(
            "Registry",
            "recordDonation",
            id,
            () -> link.recordDonation(donor, amount, sequence)));
    effects.publish(
        eventPublisher,
        new DonationReceivedEvent(id, donor, assetId, amount, fundsRaised, clock.instant()));

    if (status == ProjectStatus.ACTIVE && fundsRaised >= goal) {
      changeStatus(ProjectStatus.FUNDED, effects);
    }
  }

  // ==================== Release ====================

  /**
   * 에스크로 정산: 수수료는 재무 계정으로, 나머지는 관리자에게 한 번의 일괄 이체로 지급하고 COMPLETED로 전이합니다.
   *
   * @return 적용된 수수료 분배
   */
  public FeeSplit releaseFunds(Address caller) {
    return guarded(
        effects -> {
          requireInitialized();
          requireAdmin(caller);
          if (status == ProjectStatus.COMPLETED) {
            throw new AlreadyReleasedException(id);
          }
          if (status == ProjectStatus.CANCELLED) {
            throw new InvalidStatusTransitionException(
                status.name(), ProjectStatus.COMPLETED.name());
          }
          if (fundsRaised < goal) {
            throw new GoalNotReachedException(fundsRaised, goal);
          }

          long totalHeld = nativeLedger.balanceOf(address);
          FeeSplit split = FeeCalculator.split(totalHeld, registry.feeBasisPoints());
          Address treasury = registry.treasury();
          transferBatch(
              List.of(new Transfer(treasury, split.fee()), new Transfer(admin, split.net())),
              "release");

          changeStatus(ProjectStatus.COMPLETED, effects);
          effects.publish(
              eventPublisher,
              new FundsReleasedEvent(
                  id, admin, split.net(), treasury, split.fee(), clock.instant()));
          return split;
        });
  }

  // ==================== Evidence ====================

  /**
   * 완료 증빙 추가 (append-only)
   *
   * @return 추가된 기록의 인덱스
   */
  public int submitEvidence(Address caller, String contentHash) {
    return guarded(
        effects -> {
          requireInitialized();
          requireAdmin(caller);
          if (contentHash == null || contentHash.isBlank()) {
            throw new InvalidReferenceException("contentHash is blank");
          }
          EvidenceRecord record = new EvidenceRecord(contentHash, clock.instant(), caller);
          evidence.add(record);
          int index = evidence.size() - 1;
          effects.publish(
              eventPublisher,
              new EvidenceSubmittedEvent(id, index, contentHash, caller, record.submittedAt()));
          return index;
        });
  }

  // ==================== Status ====================

  /**
   * 관리자에 의한 명시적 상태 변경
   *
   * <p>COMPLETED 이후 변경, 그래프 밖의 전이, 목표 미달 상태의 FUNDED 설정, COMPLETED 직접 설정(정산 전용)을 거부합니다.
   */
  public void updateStatus(Address caller, ProjectStatus newStatus) {
    guarded(
        effects -> {
          requireInitialized();
          requireAdmin(caller);
          Objects.requireNonNull(newStatus, "newStatus");
          if (newStatus == ProjectStatus.COMPLETED
              || !status.canTransitionTo(newStatus)
              || (newStatus == ProjectStatus.FUNDED && fundsRaised < goal)) {
            throw new InvalidStatusTransitionException(status.name(), newStatus.name());
          }
          changeStatus(newStatus, effects);
          return null;
        });
  }

  public void cancel(Address caller) {
    updateStatus(caller, ProjectStatus.CANCELLED);
  }

  private void changeStatus(ProjectStatus next, PendingEffects effects) {
    ProjectStatus previous = status;
    status = next;
    effects.publish(
        eventPublisher, new ProjectStatusChangedEvent(id, previous, next, clock.instant()));
  }

  // ==================== Refunds ====================

  /**
   * 단일 후원자 환불 (CANCELLED 전용)
   *
   * <p>기록상 누적액은 0이 되고 모금액에서 차감되지만, 실제로 반환되는 것은 기본 자산 기여분뿐입니다. 토큰 기여분은 에스크로에 남습니다. 전역 원장은
   * 차감하지 않습니다.
   *
   * @return 반환된 기본 자산 금액
   */
  public long refundDonor(Address caller, Address donor) {
    return guarded(
        effects -> {
          requireRefundable(caller);
          Address.requireActor(donor, "donor");
          long recorded = ledger.donationOf(donor);
          if (recorded == 0) {
            throw new NoRecordedDonationException(id, donor.value());
          }
          long nativePortion = ledger.nativeContributionOf(donor);
          transferBatch(List.of(new Transfer(donor, nativePortion)), "refund");

          ledger.clear(donor);
          fundsRaised -= recorded;
          effects.publish(
              eventPublisher,
              new DonorRefundedEvent(id, donor, recorded, nativePortion, clock.instant()));
          return nativePortion;
        });
  }

  /**
   * 전체 후원자 환불 (CANCELLED 전용). 모든 기본 자산 기여분을 한 번의 일괄 이체로 반환하고 후원자 목록을 비웁니다.
   *
   * @return 반환된 기본 자산 총액
   */
  public long refundAllDonors(Address caller) {
    return guarded(
        effects -> {
          requireRefundable(caller);
          List<Address> donors = ledger.donors();
          List<Transfer> refunds = new ArrayList<>();
          long refundedTotal = 0;
          for (Address donor : donors) {
            long nativePortion = ledger.nativeContributionOf(donor);
            refunds.add(new Transfer(donor, nativePortion));
            refundedTotal += nativePortion;
          }
          transferBatch(refunds, "refundAll");

          for (Address donor : donors) {
            effects.publish(
                eventPublisher,
                new DonorRefundedEvent(
                    id,
                    donor,
                    ledger.donationOf(donor),
                    ledger.nativeContributionOf(donor),
                    clock.instant()));
          }
          ledger.clearAll();
          fundsRaised = 0;
          return refundedTotal;
        });
  }

  private void requireRefundable(Address caller) {
    requireInitialized();
    requireAdmin(caller);
    if (status != ProjectStatus.CANCELLED) {
      throw new InvalidStatusTransitionException(status.name(), "REFUND");
    }
  }

  // ==================== Reads ====================

  public ProjectSummary summary() {
    return read(
        () ->
            new ProjectSummary(
                id,
                address,
                admin,
                goal,
                fundsRaised,
                status,
                metadataRef,
                ledger.donorCount(),
                evidence.size()));
  }

  public long id() {
    return read(() -> id);
  }

  public Address admin() {
    return read(() -> admin);
  }

  public long goal() {
    return read(() -> goal);
  }

  public long fundsRaised() {
    return read(() -> fundsRaised);
  }

  public ProjectStatus status() {
    return read(() -> status);
  }

  public String metadataRef() {
    return read(() -> metadataRef);
  }

  public long donationOf(Address donor) {
    return read(() -> ledger.donationOf(donor));
  }

  public long nativeContributionOf(Address donor) {
    return read(() -> ledger.nativeContributionOf(donor));
  }

  public long heldTokenBalance(String assetId) {
    return read(() -> ledger.heldTokenBalance(assetId));
  }

  public List<Address> donors() {
    return read(ledger::donors);
  }

  public int evidenceCount() {
    return read(evidence::size);
  }

  public EvidenceRecord evidence(int index) {
    return read(
        () -> {
          if (index < 0 || index >= evidence.size()) {
            throw new EvidenceNotFoundException(index, evidence.size());
          }
          return evidence.get(index);
        });
  }

  public boolean isInitialized() {
    lock.lock();
    try {
      return initialized;
    } finally {
      lock.unlock();
    }
  }

  // ==================== Internals ====================

  private void requireInitialized() {
    if (!initialized) {
      throw new NotInitializedException(address.value());
    }
  }

  private void requireAdmin(Address caller) {
    if (caller == null || !caller.equals(admin)) {
      throw new UnauthorizedException(String.valueOf(caller), PROJECT_ADMIN);
    }
  }

  /** 0원 항목을 제외하고 일괄 이체합니다. 실패 시 어떤 이체도 반영되지 않습니다. */
  private void transferBatch(List<Transfer> transfers, String purpose) {
    List<Transfer> payable = transfers.stream().filter(t -> t.amount() > 0).toList();
    if (payable.isEmpty()) {
      return;
    }
    boolean transferred;
    try {
      transferred = nativeLedger.transferAll(address, payable);
    } catch (BaseException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TransferFailureException(purpose + " from " + address, e);
    }
    if (!transferred) {
      throw new TransferFailureException(purpose + " from " + address);
    }
  }

  private <T> T read(Supplier<T> reader) {
    lock.lock();
    try {
      requireInitialized();
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
}
