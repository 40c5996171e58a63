package crowd.ledger.controller.dto.project;

import crowd.ledger.domain.model.project.EvidenceRecord;
import java.time.Instant;

public record EvidenceResponse(int index, String contentHash, Instant submittedAt, String submitter) {

  public static EvidenceResponse of(int index, EvidenceRecord record) {
    return new EvidenceResponse(
        index, record.contentHash(), record.submittedAt(), record.submitter().value());
  }
}
