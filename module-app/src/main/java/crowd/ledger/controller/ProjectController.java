package crowd.ledger.controller;

import crowd.ledger.controller.dto.project.CreateProjectRequest;
import crowd.ledger.controller.dto.project.DonationRequest;
import crowd.ledger.controller.dto.project.DonationResponse;
import crowd.ledger.controller.dto.project.EvidenceRequest;
import crowd.ledger.controller.dto.project.EvidenceResponse;
import crowd.ledger.controller.dto.project.ProjectResponse;
import crowd.ledger.controller.dto.project.RefundResponse;
import crowd.ledger.controller.dto.project.ReleaseResponse;
import crowd.ledger.controller.dto.project.StatusUpdateRequest;
import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.project.ProjectSummary;
import crowd.ledger.global.response.ApiResponse;
import crowd.ledger.service.FundingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 프로젝트 에스크로 API
 *
 * <p>엔드포인트:
 *
 * <ul>
 *   <li>POST /api/v1/projects - 프로젝트 생성 (PROJECT_CREATOR)
 *   <li>GET /api/v1/projects, /api/v1/projects/{id} - 조회
 *   <li>POST /api/v1/projects/{id}/donations - 네이티브/토큰 후원
 *   <li>POST /api/v1/projects/{id}/release - 정산 (프로젝트 관리자)
 *   <li>POST /api/v1/projects/{id}/evidence - 증빙 제출 (프로젝트 관리자)
 *   <li>PUT /api/v1/projects/{id}/status, POST /api/v1/projects/{id}/cancel - 상태 변경
 *   <li>POST /api/v1/projects/{id}/refunds[/{donor}] - 환불 (CANCELLED 이후)
 * </ul>
 *
 * <p>호출자는 {@value CallerHeaders#CALLER} 헤더로 식별합니다.
 */
@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
@Tag(name = "Project", description = "프로젝트 에스크로 API")
public class ProjectController {

  private final FundingService fundingService;

  @PostMapping
  @Operation(summary = "프로젝트 생성", description = "레지스트리 템플릿으로 새 에스크로 인스턴스를 만듭니다.")
  public ResponseEntity<ApiResponse<ProjectResponse>> createProject(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @Valid @RequestBody CreateProjectRequest request) {
    ProjectSummary summary =
        fundingService.createProject(
            CallerHeaders.caller(caller),
            Address.of(request.admin()),
            request.fundingGoal(),
            request.metadataRef());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.success(ProjectResponse.from(summary)));
  }

  @GetMapping
  @Operation(summary = "프로젝트 목록")
  public ResponseEntity<ApiResponse<List<ProjectResponse>>> listProjects() {
    List<ProjectResponse> projects =
        fundingService.listProjects().stream().map(ProjectResponse::from).toList();
    return ResponseEntity.ok(ApiResponse.success(projects));
  }

  @GetMapping("/{projectId}")
  @Operation(summary = "프로젝트 조회")
  public ResponseEntity<ApiResponse<ProjectResponse>> getProject(@PathVariable long projectId) {
    return ResponseEntity.ok(
        ApiResponse.success(ProjectResponse.from(fundingService.getProject(projectId))));
  }

  /** assetId를 생략하면 네이티브 자산 후원입니다. 토큰 후원은 인스턴스 주소에 대한 allowance가 먼저 필요합니다. */
  @PostMapping("/{projectId}/donations")
  @Operation(summary = "후원", description = "목표 도달 시 FUNDED로 자동 전환됩니다.")
  public ResponseEntity<ApiResponse<ProjectResponse>> donate(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @PathVariable long projectId,
      @RequestBody DonationRequest request) {
    String assetId = request.isNative() ? null : request.assetId();
    ProjectSummary summary =
        fundingService.donate(
            CallerHeaders.caller(caller), projectId, assetId, request.amount());
    return ResponseEntity.ok(ApiResponse.success(ProjectResponse.from(summary)));
  }

  @GetMapping("/{projectId}/donations/{donor}")
  @Operation(summary = "후원자별 기록 조회")
  public ResponseEntity<ApiResponse<DonationResponse>> getDonation(
      @PathVariable long projectId, @PathVariable String donor) {
    Address donorAddress = Address.of(donor);
    DonationResponse response =
        new DonationResponse(
            projectId,
            donorAddress.value(),
            fundingService.donationOf(projectId, donorAddress),
            fundingService.nativeContributionOf(projectId, donorAddress));
    return ResponseEntity.ok(ApiResponse.success(response));
  }

  @PostMapping("/{projectId}/release")
  @Operation(summary = "정산", description = "수수료는 재무 계정으로, 나머지는 관리자에게 이체됩니다.")
  public ResponseEntity<ApiResponse<ReleaseResponse>> release(
      @RequestHeader(CallerHeaders.CALLER) String caller, @PathVariable long projectId) {
    return ResponseEntity.ok(
        ApiResponse.success(
            ReleaseResponse.of(
                projectId,
                fundingService.releaseFunds(CallerHeaders.caller(caller), projectId))));
  }

  @PostMapping("/{projectId}/evidence")
  @Operation(summary = "증빙 제출")
  public ResponseEntity<ApiResponse<EvidenceResponse>> submitEvidence(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @PathVariable long projectId,
      @Valid @RequestBody EvidenceRequest request) {
    int index =
        fundingService.submitEvidence(
            CallerHeaders.caller(caller), projectId, request.contentHash());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            ApiResponse.success(
                EvidenceResponse.of(index, fundingService.getEvidence(projectId, index))));
  }

  @GetMapping("/{projectId}/evidence/{index}")
  @Operation(summary = "증빙 조회")
  public ResponseEntity<ApiResponse<EvidenceResponse>> getEvidence(
      @PathVariable long projectId, @PathVariable int index) {
    return ResponseEntity.ok(
        ApiResponse.success(
            EvidenceResponse.of(index, fundingService.getEvidence(projectId, index))));
  }

  @PutMapping("/{projectId}/status")
  @Operation(summary = "상태 변경", description = "COMPLETED는 정산으로만 도달할 수 있습니다.")
  public ResponseEntity<ApiResponse<ProjectResponse>> updateStatus(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @PathVariable long projectId,
      @Valid @RequestBody StatusUpdateRequest request) {
    ProjectSummary summary =
        fundingService.updateStatus(CallerHeaders.caller(caller), projectId, request.status());
    return ResponseEntity.ok(ApiResponse.success(ProjectResponse.from(summary)));
  }

  @PostMapping("/{projectId}/cancel")
  @Operation(summary = "프로젝트 취소")
  public ResponseEntity<ApiResponse<ProjectResponse>> cancel(
      @RequestHeader(CallerHeaders.CALLER) String caller, @PathVariable long projectId) {
    ProjectSummary summary = fundingService.cancel(CallerHeaders.caller(caller), projectId);
    return ResponseEntity.ok(ApiResponse.success(ProjectResponse.from(summary)));
  }

  @PostMapping("/{projectId}/refunds/{donor}")
  @Operation(summary = "후원자 환불", description = "네이티브 후원분만 반환됩니다.")
  public ResponseEntity<ApiResponse<RefundResponse>> refundDonor(
      @RequestHeader(CallerHeaders.CALLER) String caller,
      @PathVariable long projectId,
      @PathVariable String donor) {
    Address donorAddress = Address.of(donor);
    long refunded =
        fundingService.refundDonor(CallerHeaders.caller(caller), projectId, donorAddress);
    return ResponseEntity.ok(
        ApiResponse.success(new RefundResponse(projectId, donorAddress.value(), refunded)));
  }

  @PostMapping("/{projectId}/refunds")
  @Operation(summary = "전체 환불")
  public ResponseEntity<ApiResponse<RefundResponse>> refundAll(
      @RequestHeader(CallerHeaders.CALLER) String caller, @PathVariable long projectId) {
    long refunded = fundingService.refundAllDonors(CallerHeaders.caller(caller), projectId);
    return ResponseEntity.ok(ApiResponse.success(new RefundResponse(projectId, null, refunded)));
  }
}
