package crowd.ledger.core.port.out;

import java.util.Optional;

/** 자산 ID로 이체 구현체를 찾습니다. 허용 여부 판단은 레지스트리의 허용 목록 책임입니다. */
public interface AssetDirectory {

  Optional<AssetTransferPort> find(String assetId);
}
