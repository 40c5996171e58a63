package crowd.ledger.core.registry;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 후원 허용 자산 목록
 *
 * <p>프로젝트 인스턴스가 자기 락을 잡은 채로 조회하므로, 조회는 락 없이 동작해야 합니다. 기본 자산({@link #NATIVE_ASSET})은 항상 허용됩니다.
 */
public class AssetAllowlist {

  /** 플랫폼 기본 자산 ID */
  public static final String NATIVE_ASSET = "NATIVE";

  private final Set<String> allowed = ConcurrentHashMap.newKeySet();
  private volatile boolean allowAll;

  public boolean isAllowed(String assetId) {
    if (assetId == null) {
      return false;
    }
    return NATIVE_ASSET.equals(assetId) || allowAll || allowed.contains(assetId);
  }

  /** @return 새로 추가되었으면 true */
  public boolean add(String assetId) {
    return allowed.add(assetId);
  }

  /** @return 목록에 있었으면 true */
  public boolean remove(String assetId) {
    return allowed.remove(assetId);
  }

  public void setAllowAll(boolean allowAll) {
    this.allowAll = allowAll;
  }

  public boolean isAllowAll() {
    return allowAll;
  }

  /** 명시적으로 등록된 자산 ID (정렬) */
  public Set<String> assets() {
    return new TreeSet<>(allowed);
  }
}
