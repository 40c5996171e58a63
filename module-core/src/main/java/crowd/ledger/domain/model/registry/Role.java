package crowd.ledger.domain.model.registry;

/** 플랫폼 권한. 프로젝트 관리자는 역할이 아니라 인스턴스의 admin 필드로 표현됩니다. */
public enum Role {
  /** 수수료, 재무 계정, 일시 중지, 허용 자산, 역할, 템플릿 관리 */
  PLATFORM_ADMIN,
  /** createProject 호출 권한 */
  PROJECT_CREATOR,
  /** 배지 발급 트리거 권한 (외부 운영자) */
  BADGE_OPERATOR
}
