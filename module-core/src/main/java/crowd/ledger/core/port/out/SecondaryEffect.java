package crowd.ledger.core.port.out;

import java.util.Objects;

/**
 * 주 연산 커밋 이후 실행되는 부수 효과
 *
 * <p>component/operation은 고정 분류(메트릭 태그), detail은 로그 전용 동적 값입니다.
 */
public record SecondaryEffect(String component, String operation, String detail, Runnable action) {

  public SecondaryEffect {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(action, "action");
    if (detail == null) {
      detail = "";
    }
  }

  public static SecondaryEffect of(
      String component, String operation, Object detail, Runnable action) {
    return new SecondaryEffect(component, operation, String.valueOf(detail), action);
  }
}
