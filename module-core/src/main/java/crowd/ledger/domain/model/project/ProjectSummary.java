package crowd.ledger.domain.model.project;

import crowd.ledger.domain.model.account.Address;

/**
 * 프로젝트 인스턴스 요약 (읽기 전용 스냅샷)
 *
 * @param id 레지스트리가 부여한 순차 ID
 * @param address 인스턴스 주소
 * @param admin 프로젝트 관리자
 * @param goal 목표 금액 (subunit)
 * @param fundsRaised 현재 모금액 (환불 반영)
 * @param status 현재 상태
 * @param metadataRef 메타데이터 콘텐츠 해시
 * @param donorCount 고유 후원자 수
 * @param evidenceCount 증빙 기록 수
 */
public record ProjectSummary(
    long id,
    Address address,
    Address admin,
    long goal,
    long fundsRaised,
    ProjectStatus status,
    String metadataRef,
    int donorCount,
    int evidenceCount) {

  public boolean goalReached() {
    return fundsRaised >= goal;
  }
}
