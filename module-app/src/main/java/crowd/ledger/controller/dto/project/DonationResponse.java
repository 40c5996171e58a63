package crowd.ledger.controller.dto.project;

/**
 * 후원자별 기록
 *
 * @param recorded 프로젝트에 기록된 누적 후원액 (모든 자산 합계)
 * @param nativeContribution 네이티브 자산으로 낸 금액 (환불 가능분)
 */
public record DonationResponse(
    long projectId, String donor, long recorded, long nativeContribution) {}
