package crowd.ledger.service;

import crowd.ledger.core.registry.ProjectRegistry;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import crowd.ledger.infrastructure.executor.TaskContext;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** 플랫폼 설정 변경과 배지 발급 트리거 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistryAdminService {

  private static final String COMPONENT = "Registry";

  private final ProjectRegistry registry;
  private final LogicExecutor executor;

  /** 설정 및 글로벌 집계 스냅샷 */
  public RegistrySnapshot snapshot() {
    return executor.execute(
        () ->
            new RegistrySnapshot(
                registry.registryAddress(),
                registry.feeBasisPoints(),
                registry.treasury(),
                registry.isPaused(),
                registry.isAllowAllAssets(),
                List.copyOf(registry.allowedAssets()),
                registry.projectCount(),
                registry.totalDonors(),
                registry.totalDonationCount(),
                registry.totalFundsRaised()),
        TaskContext.of(COMPONENT, "snapshot"));
  }

  public void updateFee(Address caller, int basisPoints) {
    run("updateFee", () -> registry.updateFee(caller, basisPoints), "bps=" + basisPoints);
  }

  public void updateTreasury(Address caller, Address treasury) {
    run("updateTreasury", () -> registry.updateTreasury(caller, treasury), treasury.value());
  }

  public void pause(Address caller) {
    run("pause", () -> registry.pause(caller), caller.value());
  }

  public void unpause(Address caller) {
    run("unpause", () -> registry.unpause(caller), caller.value());
  }

  public void addAllowedAsset(Address caller, String assetId) {
    run("addAllowedAsset", () -> registry.addAllowedAsset(caller, assetId), assetId);
  }

  public void removeAllowedAsset(Address caller, String assetId) {
    run("removeAllowedAsset", () -> registry.removeAllowedAsset(caller, assetId), assetId);
  }

  public void setAllowAllAssets(Address caller, boolean allowAll) {
    run("setAllowAllAssets", () -> registry.setAllowAllAssets(caller, allowAll), "" + allowAll);
  }

  public void grantRole(Address caller, Role role, Address account) {
    run("grantRole", () -> registry.grantRole(caller, role, account), role + ":" + account);
  }

  public void revokeRole(Address caller, Role role, Address account) {
    run("revokeRole", () -> registry.revokeRole(caller, role, account), role + ":" + account);
  }

  public boolean hasRole(Role role, Address account) {
    return registry.hasRole(role, account);
  }

  public String triggerBadgeMint(
      Address caller, long projectId, Address donor, String metadataRef) {
    return executor.execute(
        () -> {
          String badgeId = registry.triggerBadgeMint(caller, projectId, donor, metadataRef);
          log.info(
              "[Registry] Badge minted: projectId={}, donor={}, badgeId={}",
              projectId,
              donor,
              badgeId);
          return badgeId;
        },
        TaskContext.of(COMPONENT, "triggerBadgeMint", "projectId=" + projectId));
  }

  private void run(String operation, Runnable change, String detail) {
    executor.executeVoid(change::run, TaskContext.of(COMPONENT, operation, detail));
    log.info("[Registry] Setting changed: operation={}, value={}", operation, detail);
  }

  /** 레지스트리 상태 스냅샷 (조회 시점 기준, 원자적이지 않음) */
  public record RegistrySnapshot(
      Address registryAddress,
      int feeBasisPoints,
      Address treasury,
      boolean paused,
      boolean allowAllAssets,
      List<String> allowedAssets,
      int projectCount,
      int totalDonors,
      long totalDonationCount,
      long totalFundsRaised) {}
}
