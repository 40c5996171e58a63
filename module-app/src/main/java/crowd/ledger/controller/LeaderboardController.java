package crowd.ledger.controller;

import crowd.ledger.controller.dto.registry.GlobalDonorResponse;
import crowd.ledger.controller.dto.registry.LeaderboardResponse;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.global.response.ApiResponse;
import crowd.ledger.service.FundingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 전역 후원 리더보드 API
 *
 * <ul>
 *   <li>GET /api/v1/leaderboard?start=0&amp;end=10 - [start, end) 구간 (누적액 내림차순, 동점은 최초 후원 순)
 *   <li>GET /api/v1/leaderboard/donors/{donor} - 후원자 전역 누적액
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/leaderboard")
@RequiredArgsConstructor
@Tag(name = "Leaderboard", description = "전역 후원 순위 API")
public class LeaderboardController {

  private final FundingService fundingService;

  @GetMapping
  @Operation(summary = "리더보드 구간 조회")
  public ResponseEntity<ApiResponse<LeaderboardResponse>> leaderboard(
      @RequestParam(defaultValue = "0") int start, @RequestParam(defaultValue = "10") int end) {
    return ResponseEntity.ok(
        ApiResponse.success(LeaderboardResponse.of(start, fundingService.leaderboard(start, end))));
  }

  @GetMapping("/donors/{donor}")
  @Operation(summary = "후원자 전역 누적액")
  public ResponseEntity<ApiResponse<GlobalDonorResponse>> donor(@PathVariable String donor) {
    Address address = Address.of(donor);
    return ResponseEntity.ok(
        ApiResponse.success(
            new GlobalDonorResponse(address.value(), fundingService.globalDonationOf(address))));
  }
}
