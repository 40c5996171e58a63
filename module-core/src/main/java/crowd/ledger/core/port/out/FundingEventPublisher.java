package crowd.ledger.core.port.out;

import crowd.ledger.core.event.FundingEvent;

/** 도메인 이벤트 발행 포트. 커밋 이후 부수 효과로만 호출됩니다. */
@FunctionalInterface
public interface FundingEventPublisher {

  void publish(FundingEvent event);

  static FundingEventPublisher noop() {
    return event -> {};
  }
}
