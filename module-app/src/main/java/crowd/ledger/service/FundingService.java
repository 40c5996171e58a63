package crowd.ledger.service;

import crowd.ledger.core.project.ProjectEscrow;
import crowd.ledger.core.registry.ProjectRegistry;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.project.EvidenceRecord;
import crowd.ledger.domain.model.project.ProjectStatus;
import crowd.ledger.domain.model.project.ProjectSummary;
import crowd.ledger.domain.model.registry.FeeSplit;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import crowd.ledger.infrastructure.executor.TaskContext;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 프로젝트 생성, 후원, 정산, 환불 유스케이스
 *
 * <p>모든 호출은 {@link LogicExecutor}를 거쳐 메트릭과 예외 변환을 통일합니다. 권한, 상태, 금액 검증은 레지스트리와 인스턴스가 담당하며 이
 * 계층은 주소 변환과 라우팅만 합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FundingService {

  private static final String COMPONENT = "Funding";

  private final ProjectRegistry registry;
  private final LogicExecutor executor;

  public ProjectSummary createProject(
      Address caller, Address admin, long fundingGoal, String metadataRef) {
    return executor.execute(
        () -> {
          long projectId = registry.createProject(caller, admin, fundingGoal, metadataRef);
          log.info(
              "[Funding] Project created: projectId={}, admin={}, goal={}",
              projectId,
              admin,
              fundingGoal);
          return registry.project(projectId).summary();
        },
        TaskContext.of(COMPONENT, "createProject", "admin=" + admin));
  }

  public ProjectSummary getProject(long projectId) {
    return executor.execute(
        () -> registry.project(projectId).summary(),
        TaskContext.of(COMPONENT, "getProject", "projectId=" + projectId));
  }

  public List<ProjectSummary> listProjects() {
    return executor.execute(
        () -> registry.projectIds().stream().map(id -> registry.project(id).summary()).toList(),
        TaskContext.of(COMPONENT, "listProjects"));
  }

  /** assetId가 null이면 네이티브 자산으로 후원합니다. */
  public ProjectSummary donate(Address donor, long projectId, String assetId, long amount) {
    return executor.execute(
        () -> {
          ProjectEscrow project = registry.project(projectId);
          if (assetId == null) {
            project.donate(donor, amount);
          } else {
            project.donateToken(donor, assetId, amount);
          }
          return project.summary();
        },
        TaskContext.of(COMPONENT, "donate", "projectId=" + projectId));
  }

  public FeeSplit releaseFunds(Address caller, long projectId) {
    return executor.execute(
        () -> registry.project(projectId).releaseFunds(caller),
        TaskContext.of(COMPONENT, "release", "projectId=" + projectId));
  }

  public int submitEvidence(Address caller, long projectId, String contentHash) {
    return executor.execute(
        () -> registry.project(projectId).submitEvidence(caller, contentHash),
        TaskContext.of(COMPONENT, "submitEvidence", "projectId=" + projectId));
  }

  public EvidenceRecord getEvidence(long projectId, int index) {
    return executor.execute(
        () -> registry.project(projectId).evidence(index),
        TaskContext.of(COMPONENT, "getEvidence", "projectId=" + projectId));
  }

  public ProjectSummary updateStatus(Address caller, long projectId, ProjectStatus status) {
    return executor.execute(
        () -> {
          ProjectEscrow project = registry.project(projectId);
          project.updateStatus(caller, status);
          return project.summary();
        },
        TaskContext.of(COMPONENT, "updateStatus", "projectId=" + projectId));
  }

  public ProjectSummary cancel(Address caller, long projectId) {
    return executor.execute(
        () -> {
          ProjectEscrow project = registry.project(projectId);
          project.cancel(caller);
          return project.summary();
        },
        TaskContext.of(COMPONENT, "cancel", "projectId=" + projectId));
  }

  public long refundDonor(Address caller, long projectId, Address donor) {
    return executor.execute(
        () -> registry.project(projectId).refundDonor(caller, donor),
        TaskContext.of(COMPONENT, "refundDonor", "projectId=" + projectId));
  }

  public long refundAllDonors(Address caller, long projectId) {
    return executor.execute(
        () -> registry.project(projectId).refundAllDonors(caller),
        TaskContext.of(COMPONENT, "refundAll", "projectId=" + projectId));
  }

  public long donationOf(long projectId, Address donor) {
    return executor.execute(
        () -> registry.project(projectId).donationOf(donor),
        TaskContext.of(COMPONENT, "donationOf", "projectId=" + projectId));
  }

  public long nativeContributionOf(long projectId, Address donor) {
    return executor.execute(
        () -> registry.project(projectId).nativeContributionOf(donor),
        TaskContext.of(COMPONENT, "nativeContributionOf", "projectId=" + projectId));
  }

  public LeaderboardPage leaderboard(int start, int end) {
    return executor.execute(
        () -> registry.getLeaderboard(start, end),
        TaskContext.of(COMPONENT, "leaderboard", start + ".." + end));
  }

  public long globalDonationOf(Address donor) {
    return executor.execute(
        () -> registry.globalDonationOf(donor), TaskContext.of(COMPONENT, "globalDonationOf"));
  }
}
