package crowd.ledger.support;

import crowd.ledger.core.port.out.AssetTransferPort;
import crowd.ledger.domain.model.account.Address;
import java.util.HashMap;
import java.util.Map;

/**
 * 테스트용 대체 가능 자산
 *
 * <p>onTransferFrom 훅으로 이체 도중의 외부 콜백(재진입 시도)을 흉내 낼 수 있습니다.
 */
public class TestFungibleAsset implements AssetTransferPort {

  private final String assetId;
  private final Map<Address, Long> balances = new HashMap<>();
  private Runnable onTransferFrom = () -> {};
  private boolean refuse;

  public TestFungibleAsset(String assetId) {
    this.assetId = assetId;
  }

  public void mint(Address account, long amount) {
    balances.merge(account, amount, Long::sum);
  }

  public void onTransferFrom(Runnable hook) {
    this.onTransferFrom = hook;
  }

  public void refuseTransfers() {
    this.refuse = true;
  }

  @Override
  public String assetId() {
    return assetId;
  }

  @Override
  public long balanceOf(Address account) {
    return balances.getOrDefault(account, 0L);
  }

  @Override
  public boolean transferFrom(Address spender, Address from, Address to, long amount) {
    onTransferFrom.run();
    return transfer(from, to, amount);
  }

  @Override
  public boolean transfer(Address sender, Address to, long amount) {
    if (refuse || balanceOf(sender) < amount) {
      return false;
    }
    balances.merge(sender, -amount, Long::sum);
    balances.merge(to, amount, Long::sum);
    return true;
  }
}
