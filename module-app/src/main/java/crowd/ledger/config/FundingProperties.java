package crowd.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 펀딩 레지스트리 부트스트랩 설정
 *
 * <h3>설정 경로</h3>
 *
 * <pre>
 * funding:
 *   registry-address: registry-main
 *   platform-admin: platform-admin
 *   treasury: platform-treasury
 *   fee-basis-points: 250
 *   assets: [USDC, DAI]
 *   allowed-assets: [USDC]
 *   badge:
 *     silver-threshold: 1000
 *     gold-threshold: 10000
 *   secondary:
 *     mode: async
 * </pre>
 *
 * <p>assets는 자산 디렉터리에 등록될 토큰 목록이고, allowed-assets는 기동 시 허용 목록에 올라갈 부분집합입니다.
 *
 * @param registryAddress 레지스트리 주소 (인스턴스 주소의 prefix)
 * @param platformAdmin 초기 플랫폼 관리자 (PLATFORM_ADMIN + PROJECT_CREATOR)
 * @param treasury 수수료 수령 계정
 * @param feeBasisPoints 플랫폼 수수료 (bps, 상한 5000)
 * @param allowAllAssets 자산 디렉터리의 모든 토큰 허용 여부
 * @param assets 디렉터리에 등록할 토큰 ID
 * @param allowedAssets 기동 시 허용할 토큰 ID
 * @param projectCreators 추가 PROJECT_CREATOR 계정
 * @param badgeOperators BADGE_OPERATOR 계정
 */
@Validated
@ConfigurationProperties(prefix = "funding")
public record FundingProperties(
    @NotBlank @DefaultValue("registry-main") String registryAddress,
    @NotBlank @DefaultValue("platform-admin") String platformAdmin,
    @NotBlank @DefaultValue("platform-treasury") String treasury,
    @DefaultValue("250") @Min(0) @Max(5000) int feeBasisPoints,
    @DefaultValue("false") boolean allowAllAssets,
    @DefaultValue List<String> assets,
    @DefaultValue List<String> allowedAssets,
    @DefaultValue List<String> projectCreators,
    @DefaultValue List<String> badgeOperators,
    @Valid @DefaultValue Badge badge,
    @Valid @DefaultValue Secondary secondary) {

  /**
   * 배지 등급 기준 (프로젝트별 누적 후원액, subunit)
   *
   * @param silverThreshold 이 금액 이상이면 SILVER
   * @param goldThreshold 이 금액 이상이면 GOLD
   */
  public record Badge(
      @DefaultValue("1000") @Min(1) long silverThreshold,
      @DefaultValue("10000") @Min(1) long goldThreshold) {}

  /**
   * 부수 효과(프로젝션, 이벤트, 글로벌 기록) 실행 방식
   *
   * @param mode INLINE이면 호출 스레드에서, ASYNC면 전용 풀에서 실행
   */
  public record Secondary(
      @DefaultValue("ASYNC") DispatchMode mode,
      @DefaultValue("2") @Min(1) @Max(32) int corePoolSize,
      @DefaultValue("4") @Min(1) @Max(64) int maxPoolSize,
      @DefaultValue("1000") @Min(10) @Max(10000) int queueCapacity) {}

  public enum DispatchMode {
    INLINE,
    ASYNC
  }
}
