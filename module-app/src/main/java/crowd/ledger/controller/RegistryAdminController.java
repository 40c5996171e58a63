package crowd.ledger.controller;

import crowd.ledger.controller.dto.registry.AllowAllRequest;
import crowd.ledger.controller.dto.registry.BadgeMintRequest;
import crowd.ledger.controller.dto.registry.BadgeMintResponse;
import crowd.ledger.controller.dto.registry.FeeUpdateRequest;
import crowd.ledger.controller.dto.registry.RegistryStatusResponse;
import crowd.ledger.controller.dto.registry.RoleRequest;
import crowd.ledger.controller.dto.registry.TreasuryUpdateRequest;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.global.response.ApiResponse;
import crowd.ledger.service.RegistryAdminService;
import crowd.ledger.service.RegistryAdminService.RegistrySnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 레지스트리 관리 API
 *
 * <p>권한: 설정 변경은 PLATFORM_ADMIN, 배지 발급은 BADGE_OPERATOR. 검사는 레지스트리가 수행합니다.
 */
@RestController
@RequestMapping("/api/v1/registry")
@RequiredArgsConstructor
@Tag(name = "Registry", description = "플랫폼 설정 및 배지 API")
public class RegistryAdminController {

  private final RegistryAdminService adminService;

  @GetMapping
  @Operation(summary = "레지스트리 상태 조회")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> status() {
    return ResponseEntity.ok(ApiResponse.success(toResponse(adminService.snapshot())));
  }

  @PutMapping("/fee")
  @Operation(summary = "수수료 변경", description = "상한은 5000 bps입니다.")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> updateFee(
      @RequestHeader(CallerHeaders.CALLER) String caller, @RequestBody FeeUpdateRequest request) {
    adminService.updateFee(CallerHeaders.caller(caller), request.basisPoints());
    return status();
  }

  @PutMapping("/treasury")
  @Operation(summary = "재무 계정 변경")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> updateTreasury(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @Valid @RequestBody TreasuryUpdateRequest request) {
    adminService.updateTreasury(CallerHeaders.caller(caller), Address.of(request.treasury()));
    return status();
  }

  @PostMapping("/pause")
  @Operation(summary = "프로젝트 생성 일시 중지")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> pause(
      @RequestHeader(CallerHeaders.CALLER) String caller) {
    adminService.pause(CallerHeaders.caller(caller));
    return status();
  }

  @PostMapping("/unpause")
  @Operation(summary = "일시 중지 해제")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> unpause(
      @RequestHeader(CallerHeaders.CALLER) String caller) {
    adminService.unpause(CallerHeaders.caller(caller));
    return status();
  }

  @PostMapping("/assets/{assetId}")
  @Operation(summary = "허용 자산 추가")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> addAllowedAsset(
      @RequestHeader(CallerHeaders.CALLER) String caller, @PathVariable String assetId) {
    adminService.addAllowedAsset(CallerHeaders.caller(caller), assetId);
    return status();
  }

  @DeleteMapping("/assets/{assetId}")
  @Operation(summary = "허용 자산 제거")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> removeAllowedAsset(
      @RequestHeader(CallerHeaders.CALLER) String caller, @PathVariable String assetId) {
    adminService.removeAllowedAsset(CallerHeaders.caller(caller), assetId);
    return status();
  }

  @PutMapping("/assets/allow-all")
  @Operation(summary = "모든 자산 허용 토글")
  public ResponseEntity<ApiResponse<RegistryStatusResponse>> setAllowAllAssets(
      @RequestHeader(CallerHeaders.CALLER) String caller, @RequestBody AllowAllRequest request) {
    adminService.setAllowAllAssets(CallerHeaders.caller(caller), request.allowAll());
    return status();
  }

  @PostMapping("/roles")
  @Operation(summary = "역할 부여")
  public ResponseEntity<ApiResponse<Boolean>> grantRole(
      @RequestHeader(CallerHeaders.CALLER) String caller, @Valid @RequestBody RoleRequest request) {
    Address account = Address.of(request.account());
    adminService.grantRole(CallerHeaders.caller(caller), request.role(), account);
    return ResponseEntity.ok(ApiResponse.success(adminService.hasRole(request.role(), account)));
  }

  @DeleteMapping("/roles")
  @Operation(summary = "역할 회수")
  public ResponseEntity<ApiResponse<Boolean>> revokeRole(
      @RequestHeader(CallerHeaders.CALLER) String caller, @Valid @RequestBody RoleRequest request) {
    Address account = Address.of(request.account());
    adminService.revokeRole(CallerHeaders.caller(caller), request.role(), account);
    return ResponseEntity.ok(ApiResponse.success(adminService.hasRole(request.role(), account)));
  }

  @GetMapping("/roles/{role}/{account}")
  @Operation(summary = "역할 보유 여부")
  public ResponseEntity<ApiResponse<Boolean>> hasRole(
      @PathVariable Role role, @PathVariable String account) {
    return ResponseEntity.ok(ApiResponse.success(adminService.hasRole(role, Address.of(account))));
  }

  @PostMapping("/badges")
  @Operation(summary = "배지 발급 트리거", description = "프로젝트별 누적 후원액 기준으로 발급합니다.")
  public ResponseEntity<ApiResponse<BadgeMintResponse>> triggerBadgeMint(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @Valid @RequestBody BadgeMintRequest request) {
    Address donor = Address.of(request.donor());
    String badgeId =
        adminService.triggerBadgeMint(
            CallerHeaders.caller(caller), request.projectId(), donor, request.metadataRef());
    return ResponseEntity.ok(
        ApiResponse.success(new BadgeMintResponse(request.projectId(), donor.value(), badgeId)));
  }

  private RegistryStatusResponse toResponse(RegistrySnapshot snapshot) {
    return new RegistryStatusResponse(
        snapshot.registryAddress().value(),
        snapshot.feeBasisPoints(),
        snapshot.treasury().value(),
        snapshot.paused(),
        snapshot.allowAllAssets(),
        snapshot.allowedAssets(),
        snapshot.projectCount(),
        snapshot.totalDonors(),
        snapshot.totalDonationCount(),
        snapshot.totalFundsRaised());
  }
}
