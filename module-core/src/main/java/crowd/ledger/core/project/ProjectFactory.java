package crowd.ledger.core.project;

import crowd.ledger.domain.model.account.Address;

/**
 * 프로젝트 템플릿
 *
 * <p>레지스트리는 createProject마다 새 인스턴스를 받아 한 번만 초기화합니다. 인스턴스끼리 상태를 공유하지 않아야 합니다.
 */
@FunctionalInterface
public interface ProjectFactory {

  ProjectEscrow newInstance(Address instanceAddress);
}
