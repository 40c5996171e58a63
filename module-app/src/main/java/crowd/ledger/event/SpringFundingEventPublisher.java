package crowd.ledger.event;

import crowd.ledger.core.event.FundingEvent;
import crowd.ledger.core.port.out.FundingEventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;

/** 도메인 이벤트를 Spring 애플리케이션 이벤트로 재발행하는 어댑터 */
@RequiredArgsConstructor
public class SpringFundingEventPublisher implements FundingEventPublisher {

  private final ApplicationEventPublisher applicationEventPublisher;

  @Override
  public void publish(FundingEvent event) {
    applicationEventPublisher.publishEvent(event);
  }
}
