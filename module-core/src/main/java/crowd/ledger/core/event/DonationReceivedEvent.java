package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

/**
 * 후원 수신 알림
 *
 * @param assetId 후원 자산 ({@code NATIVE} 또는 허용된 자산 ID)
 * @param fundsRaised 이 후원이 반영된 직후의 프로젝트 모금액
 */
public record DonationReceivedEvent(
    long projectId,
    Address donor,
    String assetId,
    long amount,
    long fundsRaised,
    Instant occurredAt)
    implements FundingEvent {}
