package crowd.ledger.controller.dto.project;

import jakarta.validation.constraints.NotBlank;

/**
 * 프로젝트 생성 요청
 *
 * @param admin 프로젝트 관리자 주소
 * @param fundingGoal 목표 금액 (subunit, 0보다 커야 함)
 * @param metadataRef 메타데이터 콘텐츠 해시
 */
public record CreateProjectRequest(
    @NotBlank String admin, long fundingGoal, @NotBlank String metadataRef) {}
