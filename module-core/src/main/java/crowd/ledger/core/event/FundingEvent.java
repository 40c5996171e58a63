package crowd.ledger.core.event;

import java.time.Instant;

/** 펀딩 도메인 이벤트 공통 인터페이스 */
public interface FundingEvent {

  Instant occurredAt();
}
