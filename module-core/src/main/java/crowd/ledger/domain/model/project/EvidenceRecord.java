package crowd.ledger.domain.model.project;

import crowd.ledger.domain.model.account.Address;
import java.time.Instant;

/** 완료 증빙 기록 (불변, append-only 로그의 한 항목) */
public record EvidenceRecord(String contentHash, Instant submittedAt, Address submitter) {}
