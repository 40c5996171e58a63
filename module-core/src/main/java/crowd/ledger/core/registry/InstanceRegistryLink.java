package crowd.ledger.core.registry;

import crowd.ledger.core.project.ProjectEscrow;
import crowd.ledger.core.project.RegistryLink;
import crowd.ledger.domain.model.account.Address;

/** 프로젝트 하나에 바인딩된 레지스트리 링크. {@link ProjectRegistry#createProject}만 만듭니다. */
final class InstanceRegistryLink implements RegistryLink {

  private final ProjectRegistry registry;
  private final long projectId;
  private final ProjectEscrow instance;

  InstanceRegistryLink(ProjectRegistry registry, long projectId, ProjectEscrow instance) {
    this.registry = registry;
    this.projectId = projectId;
    this.instance = instance;
  }

  @Override
  public Address registryAddress() {
    return registry.registryAddress();
  }

  @Override
  public boolean isAssetAllowed(String assetId) {
    return registry.isAssetAllowed(assetId);
  }

  @Override
  public int feeBasisPoints() {
    return registry.feeBasisPoints();
  }

  @Override
  public Address treasury() {
    return registry.treasury();
  }

  @Override
  public long nextDonationSequence() {
    return registry.nextDonationSequence();
  }

  @Override
  public void recordDonation(Address donor, long amount, long sequence) {
    registry.recordDonation(instance, projectId, donor, amount, sequence);
  }
}
