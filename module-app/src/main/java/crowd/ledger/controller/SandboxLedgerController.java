package crowd.ledger.controller;

import crowd.ledger.controller.dto.ledger.ApproveRequest;
import crowd.ledger.controller.dto.ledger.BalanceResponse;
import crowd.ledger.controller.dto.ledger.FundAccountRequest;
import crowd.ledger.core.registry.AssetAllowlist;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.global.response.ApiResponse;
import crowd.ledger.service.SandboxLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 샌드박스 원장 API
 *
 * <p>{@code funding.sandbox.enabled=false}로 비활성화합니다.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "funding.sandbox",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@Tag(name = "Ledger", description = "샌드박스 원장 API")
public class SandboxLedgerController {

  private final SandboxLedgerService ledgerService;

  @PostMapping("/native/deposits")
  @Operation(summary = "네이티브 자산 입금")
  public ResponseEntity<ApiResponse<BalanceResponse>> deposit(
      @Valid @RequestBody FundAccountRequest request) {
    Address account = Address.of(request.account());
    long balance = ledgerService.deposit(account, request.amount());
    return ResponseEntity.ok(
        ApiResponse.success(
            new BalanceResponse(account.value(), AssetAllowlist.NATIVE_ASSET, balance)));
  }

  @PostMapping("/assets/{assetId}/mint")
  @Operation(summary = "토큰 발행")
  public ResponseEntity<ApiResponse<BalanceResponse>> mint(
      @PathVariable String assetId, @Valid @RequestBody FundAccountRequest request) {
    Address account = Address.of(request.account());
    long balance = ledgerService.mint(assetId, account, request.amount());
    return ResponseEntity.ok(
        ApiResponse.success(new BalanceResponse(account.value(), assetId, balance)));
  }

  @PostMapping("/assets/{assetId}/approvals")
  @Operation(summary = "프로젝트 인스턴스에 allowance 설정")
  public ResponseEntity<ApiResponse<Long>> approve(
      @PathVariable String assetId, @Valid @RequestBody ApproveRequest request) {
    long allowance =
        ledgerService.approve(
            assetId, Address.of(request.owner()), request.projectId(), request.amount());
    return ResponseEntity.ok(ApiResponse.success(allowance));
  }

  @GetMapping("/assets/{assetId}/balances/{account}")
  @Operation(summary = "잔액 조회", description = "assetId가 NATIVE면 네이티브 원장을 조회합니다.")
  public ResponseEntity<ApiResponse<BalanceResponse>> balance(
      @PathVariable String assetId, @PathVariable String account) {
    Address address = Address.of(account);
    return ResponseEntity.ok(
        ApiResponse.success(
            new BalanceResponse(
                address.value(), assetId, ledgerService.balanceOf(assetId, address))));
  }
}
