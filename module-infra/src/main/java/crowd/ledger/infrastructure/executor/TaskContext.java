package crowd.ledger.infrastructure.executor;

import java.util.Objects;

/**
 * 메트릭 카디널리티 통제를 위한 작업 컨텍스트
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("Funding", "donate", "projectId=3")
 *   → "Funding:donate:projectId=3"
 * - TaskContext.of("Registry", "leaderboard")
 *   → "Registry:leaderboard"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그로 사용 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (메트릭에서 제외)
 * </ul>
 *
 * @param component 컴포넌트 이름 (예: "Funding", "Registry", "Secondary")
 * @param operation 작업 유형 (예: "donate", "release", "recordDonation")
 * @param dynamicValue 동적 값 (예: 프로젝트 ID, 후원자 주소)
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  /** @return "component:operation[:dynamicValue]" */
  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
