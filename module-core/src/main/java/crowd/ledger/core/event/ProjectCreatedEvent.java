package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

public record ProjectCreatedEvent(
    long projectId,
    Address projectAddress,
    Address admin,
    long goal,
    String metadataRef,
    Instant occurredAt)
    implements FundingEvent {}
