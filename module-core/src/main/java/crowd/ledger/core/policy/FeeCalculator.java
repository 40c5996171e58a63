package crowd.ledger.core.policy;

import crowd.ledger.domain.model.registry.FeeSplit;
import crowd.ledger.error.exception.FeeExceedsCeilingException;
import crowd.ledger.error.exception.InvalidAmountException;
import java.math.BigInteger;

/**
 * 정산 수수료 계산기
 *
 * <p>{@code fee = floor(totalHeld * feeBps / 10000)}, 나머지는 모두 관리자 몫입니다. 곱셈은 오버플로우 없이 BigInteger로 수행하므로
 * 항상 {@code fee + net == totalHeld}가 성립합니다.
 */
public final class FeeCalculator {

  private static final BigInteger DENOMINATOR =
      BigInteger.valueOf(FundingRules.BASIS_POINTS_DENOMINATOR);

  private FeeCalculator() {}

  public static FeeSplit split(long totalHeld, int feeBasisPoints) {
    if (totalHeld < 0) {
      throw new InvalidAmountException("totalHeld=" + totalHeld);
    }
    requireValidFee(feeBasisPoints);
    long fee =
        BigInteger.valueOf(totalHeld)
            .multiply(BigInteger.valueOf(feeBasisPoints))
            .divide(DENOMINATOR)
            .longValueExact();
    return new FeeSplit(fee, totalHeld - fee);
  }

  public static void requireValidFee(int feeBasisPoints) {
    if (feeBasisPoints < 0) {
      throw new InvalidAmountException("feeBasisPoints=" + feeBasisPoints);
    }
    if (feeBasisPoints > FundingRules.FEE_CEILING_BASIS_POINTS) {
      throw new FeeExceedsCeilingException(feeBasisPoints, FundingRules.FEE_CEILING_BASIS_POINTS);
    }
  }
}
