package crowd.ledger.controller.dto.registry;

import jakarta.validation.constraints.NotBlank;

/**
 * 배지 발급 트리거 요청
 *
 * @param projectId 대상 프로젝트
 * @param donor 배지 수령 후원자
 * @param metadataRef 배지 메타데이터 콘텐츠 해시
 */
public record BadgeMintRequest(long projectId, @NotBlank String donor, @NotBlank String metadataRef) {}
