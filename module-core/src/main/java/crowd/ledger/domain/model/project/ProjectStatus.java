package crowd.ledger.domain.model.project;

import java.util.EnumSet;
import java.util.Set;

/**
 * 프로젝트 에스크로 상태
 *
 * <pre>
 * ACTIVE ──(목표 달성, 자동)──▶ FUNDED ──(releaseFunds)──▶ COMPLETED
 *   │                            │
 *   └──────(관리자 취소)──────────┴──▶ CANCELLED
 * </pre>
 *
 * <p>COMPLETED와 CANCELLED는 종료 상태입니다. 환불은 CANCELLED 이후 후원자 단위로 처리되며 별도 상태를 두지 않습니다.
 */
public enum ProjectStatus {
  ACTIVE,
  FUNDED,
  COMPLETED,
  CANCELLED;

  public Set<ProjectStatus> successors() {
    return switch (this) {
      case ACTIVE -> EnumSet.of(FUNDED, CANCELLED);
      case FUNDED -> EnumSet.of(COMPLETED, CANCELLED);
      case COMPLETED, CANCELLED -> EnumSet.noneOf(ProjectStatus.class);
    };
  }

  public boolean canTransitionTo(ProjectStatus next) {
    return successors().contains(next);
  }
}
