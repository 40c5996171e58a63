package crowd.ledger.controller.dto.registry;

public record AllowAllRequest(boolean allowAll) {}
