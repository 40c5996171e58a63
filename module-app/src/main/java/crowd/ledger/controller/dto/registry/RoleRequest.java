package crowd.ledger.controller.dto.registry;

import crowd.ledger.domain.model.registry.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RoleRequest(@NotNull Role role, @NotBlank String account) {}
