package crowd.ledger.core.auth;

import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.Role;
import crowd.ledger.error.exception.UnauthorizedException;

/**
 * 역할 기반 권한 판정
 *
 * <p>저장 표현과 무관하게 {@link Role} 단위로 권한을 확인합니다.
 */
public interface Authorizer {

  boolean hasRole(Role role, Address account);

  void grant(Role role, Address account);

  void revoke(Role role, Address account);

  default void requireRole(Role role, Address caller) {
    if (caller == null || !hasRole(role, caller)) {
      throw new UnauthorizedException(String.valueOf(caller), role.name());
    }
  }
}
