package crowd.ledger.core.event;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

public record EvidenceSubmittedEvent(
    long projectId, int index, String contentHash, Address submitter, Instant occurredAt)
    implements FundingEvent {}
