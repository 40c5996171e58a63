package crowd.ledger.core.event;

import crowd.ledger.domain.model.project.ProjectStatus;
import java.time.Instant;

public record ProjectStatusChangedEvent(
    long projectId, ProjectStatus from, ProjectStatus to, Instant occurredAt)
    implements FundingEvent {}
