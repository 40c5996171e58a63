package crowd.ledger.support;

import crowd.ledger.core.port.out.NativeAssetLedger;
import crowd.ledger.domain.model.account.Address;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** 테스트용 기본 자산 원장. failNextBatch로 일괄 이체 실패를 주입할 수 있습니다. */
public class TestNativeLedger implements NativeAssetLedger {

  private final Map<Address, Long> balances = new HashMap<>();
  private boolean failNextBatch;

  public void fund(Address account, long amount) {
    balances.merge(account, amount, Long::sum);
  }

  public void failNextBatch() {
    this.failNextBatch = true;
  }

  @Override
  public synchronized long balanceOf(Address account) {
    return balances.getOrDefault(account, 0L);
  }

  @Override
  public synchronized boolean transfer(Address from, Address to, long amount) {
    if (amount <= 0 || balanceOf(from) < amount) {
      return false;
    }
    balances.merge(from, -amount, Long::sum);
    balances.merge(to, amount, Long::sum);
    return true;
  }

  @Override
  public synchronized boolean transferAll(Address from, List<Transfer> transfers) {
    if (failNextBatch) {
      failNextBatch = false;
      return false;
    }
    long total = transfers.stream().mapToLong(Transfer::amount).sum();
    if (balanceOf(from) < total) {
      return false;
    }
    for (Transfer t : transfers) {
      balances.merge(from, -t.amount(), Long::sum);
      balances.merge(t.to(), t.amount(), Long::sum);
    }
    return true;
  }
}
