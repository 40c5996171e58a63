package crowd.ledger.controller.dto.registry;

import jakarta.validation.constraints.NotBlank;

public record TreasuryUpdateRequest(@NotBlank String treasury) {}
