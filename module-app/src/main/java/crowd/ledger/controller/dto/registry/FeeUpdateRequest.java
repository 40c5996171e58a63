package crowd.ledger.controller.dto.registry;

/** @param basisPoints 새 수수료 (bps, 상한 5000) */
public record FeeUpdateRequest(int basisPoints) {}
