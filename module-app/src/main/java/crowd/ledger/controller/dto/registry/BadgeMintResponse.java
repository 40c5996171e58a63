package crowd.ledger.controller.dto.registry;

public record BadgeMintResponse(long projectId, String donor, String badgeId) {}
