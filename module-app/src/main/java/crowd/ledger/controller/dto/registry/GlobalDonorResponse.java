package crowd.ledger.controller.dto.registry;

public record GlobalDonorResponse(String donor, long totalDonated) {}
