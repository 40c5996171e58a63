package crowd.ledger.infrastructure.ledger;

import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.core.port.out.NativeAssetLedger;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.error.exception.InvalidAmountException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 기본 자산 원장
 *
 * <p>모든 이체는 원장 모니터 안에서 수행되므로 일괄 이체는 원자적입니다. 잔액 부족이나 잘못된 금액은 예외 대신 {@code false}로 보고합니다.
 */
@Slf4j
public class InMemoryNativeAssetLedger implements NativeAssetLedger {

  private final Map<Address, Long> balances = new HashMap<>();

  /** 외부 입금 (개발/테스트용 충전) */
  public synchronized long deposit(Address account, long amount) {
    Address.requireActor(account, "depositor");
    if (amount <= 0) {
      throw new InvalidAmountException("deposit=" + amount);
    }
    long updated = FundingRules.addChecked(balanceOf(account), amount, "native balance");
    balances.put(account, updated);
    log.info("[NativeLedger] deposit: account={}, amount={}, balance={}", account, amount, updated);
    return updated;
  }

  @Override
  public synchronized long balanceOf(Address account) {
    return balances.getOrDefault(account, 0L);
  }

  @Override
  public synchronized boolean transfer(Address from, Address to, long amount) {
    if (!canDebit(from, amount) || !canCredit(to, amount)) {
      log.debug("[NativeLedger] transfer rejected: from={}, to={}, amount={}", from, to, amount);
      return false;
    }
    move(from, to, amount);
    return true;
  }

  @Override
  public synchronized boolean transferAll(Address from, List<Transfer> transfers) {
    long total = 0;
    for (Transfer t : transfers) {
      if (t.amount() <= 0 || t.to() == null || !canCredit(t.to(), t.amount())) {
        return false;
      }
      total += t.amount();
      if (total < 0) {
        return false;
      }
    }
    if (!canDebit(from, total)) {
      log.debug("[NativeLedger] batch rejected: from={}, total={}", from, total);
      return false;
    }
    for (Transfer t : transfers) {
      move(from, t.to(), t.amount());
    }
    return true;
  }

  private boolean canDebit(Address from, long amount) {
    return from != null && amount > 0 && balanceOf(from) >= amount;
  }

  private boolean canCredit(Address to, long amount) {
    return to != null && balanceOf(to) <= Long.MAX_VALUE - amount;
  }

  private void move(Address from, Address to, long amount) {
    balances.put(from, balanceOf(from) - amount);
    balances.put(to, balanceOf(to) + amount);
  }
}
