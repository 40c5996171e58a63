package crowd.ledger.infrastructure.asset;

import static org.assertj.core.api.Assertions.assertThat;

import crowd.ledger.domain.model.account.Address;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryFungibleAssetTest {

  private final Address donor = Address.of("donor");
  private final Address escrow = Address.of("escrow");

  @Test
  @DisplayName("승인 한도 안에서만 transferFrom이 성공하고 한도가 차감된다")
  void transferFromConsumesAllowance() {
    InMemoryFungibleAsset usdc = new InMemoryFungibleAsset("USDC");
    usdc.mint(donor, 500);
    usdc.approve(donor, escrow, 150);

    assertThat(usdc.transferFrom(escrow, donor, escrow, 200)).isFalse();
    assertThat(usdc.transferFrom(escrow, donor, escrow, 100)).isTrue();

    assertThat(usdc.balanceOf(escrow)).isEqualTo(100L);
    assertThat(usdc.balanceOf(donor)).isEqualTo(400L);
    assertThat(usdc.allowance(donor, escrow)).isEqualTo(50L);
  }

  @Test
  @DisplayName("디렉터리는 등록된 자산만 찾는다")
  void directoryLookup() {
    InMemoryAssetDirectory directory = new InMemoryAssetDirectory();
    directory.register(new InMemoryFungibleAsset("USDC"));

    assertThat(directory.find("USDC")).isPresent();
    assertThat(directory.find("DAI")).isEmpty();
    assertThat(directory.find(null)).isEmpty();
    assertThat(directory.assetIds()).containsExactly("USDC");
  }
}
