package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

/**
 * 후원자 환불 알림
 *
 * @param recordedAmount 0으로 초기화된 기록상 누적액 (모든 자산 합계)
 * @param nativeRefunded 실제로 반환된 기본 자산 금액 (토큰 환불은 지원하지 않음)
 */
public record DonorRefundedEvent(
    long projectId, Address donor, long recordedAmount, long nativeRefunded, Instant occurredAt)
    implements FundingEvent {}
