package crowd.ledger.controller.dto.project;

import crowd.ledger.domain.model.project.ProjectStatus;
import jakarta.validation.constraints.NotNull;

public record StatusUpdateRequest(@NotNull ProjectStatus status) {}
