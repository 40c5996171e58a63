package crowd.ledger.controller.dto.ledger;

/** @param assetId NATIVE 또는 토큰 ID */
public record BalanceResponse(String account, String assetId, long balance) {}
