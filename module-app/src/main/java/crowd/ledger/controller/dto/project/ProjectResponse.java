package crowd.ledger.controller.dto.project;

import crowd.ledger.domain.model.project.ProjectStatus;
import crowd.ledger.domain.model.project.ProjectSummary;

/** 프로젝트 조회 응답. 주소는 문자열로 노출합니다. */
public record ProjectResponse(
    long id,
    String address,
    String admin,
    long goal,
    long fundsRaised,
    ProjectStatus status,
    String metadataRef,
    int donorCount,
    int evidenceCount,
    boolean goalReached) {

  public static ProjectResponse from(ProjectSummary summary) {
    return new ProjectResponse(
        summary.id(),
        summary.address().value(),
        summary.admin().value(),
        summary.goal(),
        summary.fundsRaised(),
        summary.status(),
        summary.metadataRef(),
        summary.donorCount(),
        summary.evidenceCount(),
        summary.goalReached());
  }
}
