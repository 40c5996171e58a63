package crowd.ledger.controller.dto.project;

import crowd.ledger.domain.model.registry.FeeSplit;

/**
 * 정산 결과
 *
 * @param fee 재무 계정 수령액
 * @param net 프로젝트 관리자 수령액
 */
public record ReleaseResponse(long projectId, long fee, long net) {

  public static ReleaseResponse of(long projectId, FeeSplit split) {
    return new ReleaseResponse(projectId, split.fee(), split.net());
  }
}
