package crowd.ledger.core.port.out;

/**
 * 읽기 전용 조회 프로젝션 (검색/분석용)
 *
 * <p>best-effort 알림 대상입니다. 이 포트의 실패는 프로젝트 생성에 영향을 주지 않습니다.
 */
public interface ProjectionPort {

  void projectCreated(long projectId);
}
