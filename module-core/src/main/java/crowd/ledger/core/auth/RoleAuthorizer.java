package crowd.ledger.core.auth;

import crowd.ledger.domain.model.account.Address;
import crowd.ledger.domain.model.registry.Role;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** 메모리 기반 역할 저장소. 조회는 레지스트리 락 없이도 안전하도록 동기화됩니다. */
public class RoleAuthorizer implements Authorizer {

  private final Map<Role, Set<Address>> members = new EnumMap<>(Role.class);

  public RoleAuthorizer() {
    for (Role role : Role.values()) {
      members.put(role, new LinkedHashSet<>());
    }
  }

  @Override
  public synchronized boolean hasRole(Role role, Address account) {
    return members.get(role).contains(account);
  }

  @Override
  public synchronized void grant(Role role, Address account) {
    members.get(role).add(Address.requireActor(account, "role member"));
  }

  @Override
  public synchronized void revoke(Role role, Address account) {
    members.get(role).remove(account);
  }
}
