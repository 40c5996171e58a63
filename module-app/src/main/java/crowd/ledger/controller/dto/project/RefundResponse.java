package crowd.ledger.controller.dto.project;

/**
 * 환불 결과
 *
 * @param donor 단일 환불 대상 (전체 환불이면 null)
 * @param refunded 실제로 반환된 네이티브 금액
 */
public record RefundResponse(long projectId, String donor, long refunded) {}
