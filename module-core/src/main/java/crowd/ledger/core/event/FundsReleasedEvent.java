package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

public record FundsReleasedEvent(
    long projectId,
    Address admin,
    long netAmount,
    Address treasury,
    long feeAmount,
    Instant occurredAt)
    implements FundingEvent {}
