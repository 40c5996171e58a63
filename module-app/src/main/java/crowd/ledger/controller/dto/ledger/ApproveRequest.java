package crowd.ledger.controller.dto.ledger;

import jakarta.validation.constraints.NotBlank;

/**
 * 토큰 후원 전 프로젝트 인스턴스에 대한 allowance 설정
 *
 * @param owner 토큰 보유자
 * @param projectId spender가 될 프로젝트
 * @param amount 허용 금액
 */
public record ApproveRequest(@NotBlank String owner, long projectId, long amount) {}
