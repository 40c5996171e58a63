package crowd.ledger.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 펀딩 원장 전역 에러 코드
 *
 * <p>C 계열은 호출자 책임(4xx), S 계열은 시스템/외부 협력자 책임(5xx)입니다. 메시지는 {@link String#format} 인자를 받습니다.
 */
@Getter
@AllArgsConstructor
public enum FundingErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_AMOUNT("C001", "유효하지 않은 금액입니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_IDENTITY("C002", "유효하지 않은 식별자입니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_REFERENCE("C003", "유효하지 않은 참조값입니다: %s", HttpStatus.BAD_REQUEST),
  UNAUTHORIZED("C004", "권한이 없습니다 (호출자: %s, 필요: %s)", HttpStatus.FORBIDDEN),
  ALREADY_INITIALIZED("C005", "이미 초기화된 프로젝트입니다 (ID: %s)", HttpStatus.CONFLICT),
  NOT_INITIALIZED("C006", "초기화되지 않은 프로젝트입니다 (주소: %s)", HttpStatus.CONFLICT),
  INVALID_STATUS_TRANSITION(
      "C007", "허용되지 않는 상태 전이입니다 (%s -> %s)", HttpStatus.CONFLICT),
  PROJECT_NOT_ACTIVE("C008", "후원을 받을 수 없는 상태입니다 (ID: %s, 상태: %s)", HttpStatus.CONFLICT),
  GOAL_NOT_REACHED("C009", "목표 금액에 도달하지 않았습니다 (모금: %s, 목표: %s)", HttpStatus.CONFLICT),
  ALREADY_RELEASED("C010", "이미 정산이 완료된 프로젝트입니다 (ID: %s)", HttpStatus.CONFLICT),
  ASSET_NOT_ALLOWED("C011", "허용되지 않은 자산입니다 (자산: %s)", HttpStatus.BAD_REQUEST),
  NO_RECORDED_DONATION(
      "C012", "기록된 후원 내역이 없습니다 (프로젝트: %s, 후원자: %s)", HttpStatus.NOT_FOUND),
  UNKNOWN_PROJECT_ID("C013", "존재하지 않는 프로젝트입니다 (ID: %s)", HttpStatus.NOT_FOUND),
  FEE_EXCEEDS_CEILING(
      "C014", "수수료가 상한을 초과합니다 (요청: %s bps, 상한: %s bps)", HttpStatus.BAD_REQUEST),
  PLATFORM_PAUSED("C015", "플랫폼이 일시 중지 상태입니다", HttpStatus.LOCKED),
  REENTRANT_CALL("C016", "재진입 호출이 거부되었습니다 (대상: %s)", HttpStatus.CONFLICT),
  EVIDENCE_NOT_FOUND(
      "C017", "증빙 기록이 존재하지 않습니다 (인덱스: %s, 전체: %s)", HttpStatus.NOT_FOUND),
  INVALID_REQUEST("C018", "잘못된 요청입니다: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  TRANSFER_FAILURE("S002", "자산 이체에 실패했습니다 (%s)", HttpStatus.BAD_GATEWAY),
  TEMPLATE_MISCONFIGURED(
      "S003", "프로젝트 템플릿 설정 오류입니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
