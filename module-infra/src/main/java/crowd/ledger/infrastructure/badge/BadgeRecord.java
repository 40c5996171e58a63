package crowd.ledger.infrastructure.badge;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

/** 발급된 배지 */
public record BadgeRecord(
    String badgeId,
    Address donor,
    long projectId,
    long amount,
    BadgeTier tier,
    String metadataRef,
    Instant issuedAt) {}
