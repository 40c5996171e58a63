package crowd.ledger.controller.dto.registry;

import java.util.List;

/** 레지스트리 설정 및 글로벌 집계 스냅샷 */
public record RegistryStatusResponse(
    String registryAddress,
    int feeBasisPoints,
    String treasury,
    boolean paused,
    boolean allowAllAssets,
    List<String> allowedAssets,
    int projectCount,
    int totalDonors,
    long totalDonationCount,
    long totalFundsRaised) {}
