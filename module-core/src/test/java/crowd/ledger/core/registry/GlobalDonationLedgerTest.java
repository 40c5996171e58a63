package crowd.ledger.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crowd.ledger.domain.model.account.Address;
import crowd.ledger.error.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GlobalDonationLedgerTest {

  private final GlobalDonationLedger ledger = new GlobalDonationLedger();

  @Test
  @DisplayName("후원자 목록은 최초 후원 순서를 유지한다")
  void keepsFirstDonationOrder() {
    Address a = Address.of("a");
    Address b = Address.of("b");

    ledger.record(b, 10, 1);
    ledger.record(a, 10, 2);
    ledger.record(b, 5, 3);

    assertThat(ledger.snapshot().keySet()).containsExactly(b, a);
    assertThat(ledger.donationOf(b)).isEqualTo(15L);
    assertThat(ledger.donationCount()).isEqualTo(3L);
    assertThat(ledger.totalRaised()).isEqualTo(25L);
  }

  @Test
  @DisplayName("기록이 늦게 도착해도 커밋 순번이 앞선 후원자가 먼저다")
  void ordersByCommitSequenceNotArrival() {
    Address a = Address.of("a");
    Address b = Address.of("b");

    ledger.record(b, 50, 2);
    ledger.record(a, 50, 1);

    assertThat(ledger.snapshot().keySet()).containsExactly(a, b);
  }

  @Test
  @DisplayName("오버플로우는 InvalidAmount이며 아무것도 바뀌지 않는다")
  void overflowLeavesLedgerUntouched() {
    Address a = Address.of("a");
    ledger.record(a, Long.MAX_VALUE - 1, 1);

    assertThatThrownBy(() -> ledger.record(Address.of("b"), 10, 2))
        .isInstanceOf(InvalidAmountException.class);
    assertThat(ledger.donorCount()).isEqualTo(1);
    assertThat(ledger.donationCount()).isEqualTo(1L);
  }
}
