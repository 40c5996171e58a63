package crowd.ledger.infrastructure.asset;

import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.core.port.out.AssetTransferPort;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.error.exception.InvalidAmountException;
import crowd.ledger.error.exception.InvalidReferenceException;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 대체 가능 자산 (잔액 + 승인 한도)
 *
 * <p>{@link #transferFrom}은 spender에게 승인된 한도 안에서만 성공합니다. 실패는 {@code false}로 보고합니다.
 */
@Slf4j
public class InMemoryFungibleAsset implements AssetTransferPort {

  private final String assetId;
  private final Map<Address, Long> balances = new HashMap<>();
  private final Map<Address, Map<Address, Long>> allowances = new HashMap<>();

  public InMemoryFungibleAsset(String assetId) {
    if (assetId == null || assetId.isBlank()) {
      throw new InvalidReferenceException("assetId is blank");
    }
    this.assetId = assetId;
  }

  @Override
  public String assetId() {
    return assetId;
  }

  public synchronized void mint(Address account, long amount) {
    Address.requireActor(account, "holder");
    if (amount <= 0) {
      throw new InvalidAmountException("mint=" + amount);
    }
    balances.put(account, FundingRules.addChecked(balanceOf(account), amount, assetId));
    log.info("[Asset:{}] mint: account={}, amount={}", assetId, account, amount);
  }

  /** owner가 spender에게 amount만큼 인출을 승인합니다 (덮어쓰기). */
  public synchronized void approve(Address owner, Address spender, long amount) {
    Address.requireActor(owner, "owner");
    Address.requireActor(spender, "spender");
    if (amount < 0) {
      throw new InvalidAmountException("allowance=" + amount);
    }
    allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
  }

  public synchronized long allowance(Address owner, Address spender) {
    return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, 0L);
  }

  @Override
  public synchronized long balanceOf(Address account) {
    return balances.getOrDefault(account, 0L);
  }

  @Override
  public synchronized boolean transferFrom(Address spender, Address from, Address to, long amount) {
    long allowed = allowance(from, spender);
    if (allowed < amount) {
      log.debug(
          "[Asset:{}] transferFrom rejected: spender={}, from={}, allowance={}, amount={}",
          assetId,
          spender,
          from,
          allowed,
          amount);
      return false;
    }
    if (!transfer(from, to, amount)) {
      return false;
    }
    allowances.get(from).put(spender, allowed - amount);
    return true;
  }

  @Override
  public synchronized boolean transfer(Address sender, Address to, long amount) {
    if (sender == null || to == null || amount <= 0 || balanceOf(sender) < amount) {
      return false;
    }
    if (balanceOf(to) > Long.MAX_VALUE - amount) {
      return false;
    }
    balances.put(sender, balanceOf(sender) - amount);
    balances.put(to, balanceOf(to) + amount);
    return true;
  }
}
