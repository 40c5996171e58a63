package crowd.ledger.controller.dto.project;

import jakarta.validation.constraints.NotBlank;

public record EvidenceRequest(@NotBlank String contentHash) {}
