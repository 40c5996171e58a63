package crowd.ledger.domain.model.registry;

/**
 * 정산 시 수수료 분배 결과
 *
 * @param fee 재무 계정으로 이체될 금액 (내림)
 * @param net 프로젝트 관리자에게 이체될 나머지
 */
public record FeeSplit(long fee, long net) {

  public long total() {
    return fee + net;
  }
}
