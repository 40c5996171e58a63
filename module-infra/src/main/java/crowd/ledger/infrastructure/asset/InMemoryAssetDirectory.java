package crowd.ledger.infrastructure.asset;

import crowd.ledger.core.port.out.AssetDirectory;
import crowd.ledger.core.port.out.AssetTransferPort;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** 자산 ID → 이체 구현체. 등록 여부와 허용 여부는 별개입니다. */
public class InMemoryAssetDirectory implements AssetDirectory {

  private final Map<String, AssetTransferPort> assets = new ConcurrentHashMap<>();

  public void register(AssetTransferPort asset) {
    assets.put(asset.assetId(), asset);
  }

  @Override
  public Optional<AssetTransferPort> find(String assetId) {
    if (assetId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(assets.get(assetId));
  }

  public Set<String> assetIds() {
    return new TreeSet<>(assets.keySet());
  }
}
