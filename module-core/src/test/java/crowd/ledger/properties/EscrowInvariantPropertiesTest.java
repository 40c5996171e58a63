package crowd.ledger.properties;

import static crowd.ledger.support.FundingFixture.PROJECT_ADMIN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import crowd.ledger.core.event.ProjectStatusChangedEvent;
import crowd.ledger.core.policy.FeeCalculator;
import crowd.ledger.core.policy.FundingRules;
import crowd.ledger.core.project.ProjectEscrow;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.project.ProjectStatus;
import crowd.ledger.domain.model.registry.FeeSplit;
import crowd.ledger.domain.model.registry.LeaderboardPage;
import crowd.ledger.error.exception.AlreadyInitializedException;
import crowd.ledger.support.DetachedRegistryLink;
import crowd.ledger.support.FundingFixture;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.UniqueElements;

/**
 * 에스크로 / 레지스트리 불변식 (Property-Based)
 *
 * <h3>검증하는 불변식</h3>
 *
 * <ul>
 *   <li>ACTIVE → FUNDED 전이는 목표를 넘기는 후원에서 정확히 한 번
 *   <li>후원자별 누적액의 합 == fundsRaised
 *   <li>fee + net == totalHeld
 *   <li>두 번째 initialize는 인자와 무관하게 실패
 *   <li>서로 다른 누적액의 리더보드는 엄격한 내림차순
 *   <li>전체 환불 후 모든 누적액과 모금액은 0, 비후원자는 영향 없음
 * </ul>
 */
class EscrowInvariantPropertiesTest {

  private static final int DONORS = 4;

  @Provide
  Arbitrary<List<Long>> donationSequences() {
    return Arbitraries.longs()
        .between(FundingRules.MINIMUM_DONATION, 500)
        .list()
        .ofMinSize(1)
        .ofMaxSize(30);
  }

  /** 불변식: 목표를 처음 넘기는 후원에서 FUNDED로 정확히 한 번 전이 */
  @Property(tries = 200)
  void funded_exactly_once_at_crossing_donation(
      @ForAll @LongRange(min = 1, max = 3_000) long goal,
      @ForAll("donationSequences") List<Long> amounts) {
    FundingFixture fixture = new FundingFixture();
    ProjectEscrow escrow = fixture.createProject(goal);
    List<Address> donors = donors(fixture);

    long running = 0;
    Integer crossingIndex = null;
    for (int i = 0; i < amounts.size(); i++) {
      if (escrow.status() != ProjectStatus.ACTIVE) {
        break;
      }
      escrow.donate(donors.get(i % DONORS), amounts.get(i));
      running += amounts.get(i);
      if (crossingIndex == null && running >= goal) {
        crossingIndex = i;
        assertThat(escrow.status()).isEqualTo(ProjectStatus.FUNDED);
      } else if (crossingIndex == null) {
        assertThat(escrow.status()).isEqualTo(ProjectStatus.ACTIVE);
      }
    }

    long fundedTransitions =
        fixture.events.eventsOf(ProjectStatusChangedEvent.class).stream()
            .filter(e -> e.to() == ProjectStatus.FUNDED)
            .count();
    assertThat(fundedTransitions).isEqualTo(crossingIndex == null ? 0 : 1);
  }

  /** 불변식: 후원자별 누적액의 합은 항상 fundsRaised와 같다 */
  @Property(tries = 200)
  void donor_totals_sum_to_funds_raised(@ForAll("donationSequences") List<Long> amounts) {
    FundingFixture fixture = new FundingFixture();
    ProjectEscrow escrow = fixture.createProject(Long.MAX_VALUE);
    List<Address> donors = donors(fixture);

    for (int i = 0; i < amounts.size(); i++) {
      escrow.donate(donors.get(i % DONORS), amounts.get(i));
      long sum = escrow.donors().stream().mapToLong(escrow::donationOf).sum();
      assertThat(sum).isEqualTo(escrow.fundsRaised());
    }
  }

  /** 불변식: fee + net == totalHeld */
  @Property(tries = 500)
  void fee_split_is_exact(
      @ForAll @LongRange(min = 0, max = Long.MAX_VALUE) long totalHeld,
      @ForAll @IntRange(min = 0, max = FundingRules.FEE_CEILING_BASIS_POINTS) int feeBps) {
    FeeSplit split = FeeCalculator.split(totalHeld, feeBps);

    assertThat(split.fee() + split.net()).isEqualTo(totalHeld);
    assertThat(split.fee()).isBetween(0L, totalHeld / 2);
  }

  /** 불변식: 두 번째 initialize는 인자와 무관하게 실패 */
  @Property(tries = 50)
  void second_initialize_always_fails(
      @ForAll long id, @ForAll long goal, @ForAll("references") String metadataRef) {
    FundingFixture fixture = new FundingFixture();
    ProjectEscrow escrow = fixture.createProject(100);
    DetachedRegistryLink link = new DetachedRegistryLink();

    assertThatThrownBy(() -> escrow.initialize(link, id, Address.of("x"), goal, metadataRef))
        .isInstanceOf(AlreadyInitializedException.class);
    assertThat(escrow.goal()).isEqualTo(100L);
  }

  @Provide
  Arbitrary<String> references() {
    return Arbitraries.strings().ofMaxLength(20).injectNull(0.2);
  }

  /** 불변식: 서로 다른 누적액의 리더보드는 엄격한 내림차순이고 범위 밖은 비어 있다 */
  @Property(tries = 100)
  void leaderboard_is_strictly_descending(
      @ForAll @Size(min = 1, max = 15) @UniqueElements
          List<@LongRange(min = 10, max = 10_000) Long> totals) {
    FundingFixture fixture = new FundingFixture();
    ProjectEscrow escrow = fixture.createProject(Long.MAX_VALUE);
    for (int i = 0; i < totals.size(); i++) {
      escrow.donate(fixture.donor("donor-" + i, totals.get(i)), totals.get(i));
    }

    LeaderboardPage page = fixture.registry.getLeaderboard(0, totals.size());

    assertThat(page.size()).isEqualTo(totals.size());
    for (int i = 1; i < page.size(); i++) {
      assertThat(page.amounts().get(i - 1)).isGreaterThan(page.amounts().get(i));
    }
    assertThat(fixture.registry.getLeaderboard(totals.size(), totals.size() + 5).isEmpty())
        .isTrue();
    assertThat(fixture.registry.getLeaderboard(0, 0).isEmpty()).isTrue();
  }

  /** 불변식: 전체 환불 후 누적액과 모금액은 0, 비후원자 잔액은 그대로 */
  @Property(tries = 100)
  void refund_all_zeroes_everything(@ForAll("donationSequences") List<Long> amounts) {
    FundingFixture fixture = new FundingFixture();
    ProjectEscrow escrow = fixture.createProject(Long.MAX_VALUE);
    List<Address> donors = donors(fixture);
    Address bystander = fixture.donor("bystander", 777);
    for (int i = 0; i < amounts.size(); i++) {
      escrow.donate(donors.get(i % DONORS), amounts.get(i));
    }
    escrow.cancel(PROJECT_ADMIN);

    escrow.refundAllDonors(PROJECT_ADMIN);

    assertThat(escrow.fundsRaised()).isZero();
    for (Address donor : donors) {
      assertThat(escrow.donationOf(donor)).isZero();
      assertThat(fixture.nativeLedger.balanceOf(donor)).isEqualTo(100_000L);
    }
    assertThat(fixture.nativeLedger.balanceOf(bystander)).isEqualTo(777L);
    assertThat(escrow.donors()).isEmpty();
  }

  private static List<Address> donors(FundingFixture fixture) {
    List<Address> donors = new ArrayList<>();
    for (int i = 0; i < DONORS; i++) {
      donors.add(fixture.donor("donor-" + i, 100_000));
    }
    return donors;
  }
}
