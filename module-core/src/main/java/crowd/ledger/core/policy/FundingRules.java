package crowd.ledger.core.policy;

import crowd.ledger.error.exception.InvalidAmountException;

/**
 * 플랫폼 전역 상수와 금액 연산 규칙
 *
 * <p>최소 후원 금액은 자산의 소수 단위와 무관한 단일 상수입니다. 소수 자릿수가 다른 자산에서는 실질 최소 가치가 달라지는 알려진 한계가 있습니다.
 */
public final class FundingRules {

  /** 최소 후원 금액 (subunit, 모든 자산 공통) */
  public static final long MINIMUM_DONATION = 10L;

  /** 수수료 상한: 5000 bps = 50% */
  public static final int FEE_CEILING_BASIS_POINTS = 5_000;

  public static final int BASIS_POINTS_DENOMINATOR = 10_000;

  private FundingRules() {}

  public static void requireDonationAmount(long amount) {
    if (amount < MINIMUM_DONATION) {
      throw new InvalidAmountException(amount, MINIMUM_DONATION);
    }
  }

  public static long addChecked(long current, long amount, String subject) {
    try {
      return Math.addExact(current, amount);
    } catch (ArithmeticException e) {
      throw new InvalidAmountException(subject + " overflow");
    }
  }
}
