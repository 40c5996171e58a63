package crowd.ledger.service;

import crowd.ledger.core.registry.AssetAllowlist;
import crowd.ledger.core.registry.ProjectRegistry;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.error.exception.AssetNotAllowedException;
import crowd.ledger.infrastructure.asset.InMemoryAssetDirectory;
import crowd.ledger.infrastructure.asset.InMemoryFungibleAsset;
import crowd.ledger.infrastructure.executor.LogicExecutor;
import crowd.ledger.infrastructure.executor.TaskContext;
import crowd.ledger.infrastructure.ledger.InMemoryNativeAssetLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 인메모리 원장 조작 (입금, 토큰 발행, allowance, 잔액 조회)
 *
 * <p>외부 체인 없이 API만으로 후원 흐름을 재현하기 위한 샌드박스 기능입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SandboxLedgerService {

  private static final String COMPONENT = "Ledger";

  private final InMemoryNativeAssetLedger nativeLedger;
  private final InMemoryAssetDirectory assetDirectory;
  private final ProjectRegistry registry;
  private final LogicExecutor executor;

  public long deposit(Address account, long amount) {
    return executor.execute(
        () -> {
          long balance = nativeLedger.deposit(account, amount);
          log.info("[Ledger] Native deposit: account={}, amount={}", account, amount);
          return balance;
        },
        TaskContext.of(COMPONENT, "deposit", account.value()));
  }

  public long mint(String assetId, Address account, long amount) {
    return executor.execute(
        () -> {
          InMemoryFungibleAsset asset = token(assetId);
          asset.mint(account, amount);
          return asset.balanceOf(account);
        },
        TaskContext.of(COMPONENT, "mint", assetId));
  }

  /** 프로젝트 인스턴스 주소를 spender로 allowance를 설정합니다. */
  public long approve(String assetId, Address owner, long projectId, long amount) {
    return executor.execute(
        () -> {
          InMemoryFungibleAsset asset = token(assetId);
          Address spender = registry.projectAddress(projectId);
          asset.approve(owner, spender, amount);
          return asset.allowance(owner, spender);
        },
        TaskContext.of(COMPONENT, "approve", assetId));
  }

  public long balanceOf(String assetId, Address account) {
    if (AssetAllowlist.NATIVE_ASSET.equals(assetId)) {
      return nativeLedger.balanceOf(account);
    }
    return token(assetId).balanceOf(account);
  }

  private InMemoryFungibleAsset token(String assetId) {
    return assetDirectory
        .find(assetId)
        .filter(InMemoryFungibleAsset.class::isInstance)
        .map(InMemoryFungibleAsset.class::cast)
        .orElseThrow(() -> new AssetNotAllowedException(assetId));
  }
}
