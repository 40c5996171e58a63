package crowd.ledger.event;

import crowd.ledger.core.event.DonationReceivedEvent;
import crowd.ledger.core.event.DonorRefundedEvent;
import crowd.ledger.core.event.FundingEvent;
import crowd.ledger.core.event.FundsReleasedEvent;
import crowd.ledger.core.event.ProjectStatusChangedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 펀딩 도메인 이벤트 로깅 리스너
 *
 * <p>부수 효과 스레드에서 호출되므로 여기서 던진 예외는 디스패처가 실패로 기록하고 삼킵니다. 주 연산에는 영향이 없습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FundingEventListener {

  static final String EVENT_METRIC = "funding.events";

  private final MeterRegistry meterRegistry;

  @EventListener
  public void on(FundingEvent event) {
    Counter.builder(EVENT_METRIC)
        .tag("type", event.getClass().getSimpleName())
        .register(meterRegistry)
        .increment();

    if (event instanceof DonationReceivedEvent donation) {
      log.info(
          "[Funding] Donation received: projectId={}, donor={}, asset={}, amount={}, raised={}",
          donation.projectId(),
          donation.donor(),
          donation.assetId(),
          donation.amount(),
          donation.fundsRaised());
    } else if (event instanceof FundsReleasedEvent released) {
      log.info(
          "[Funding] Funds released: projectId={}, net={}, fee={}, treasury={}",
          released.projectId(),
          released.netAmount(),
          released.feeAmount(),
          released.treasury());
    } else if (event instanceof ProjectStatusChangedEvent changed) {
      log.info(
          "[Funding] Status changed: projectId={}, {} -> {}",
          changed.projectId(),
          changed.from(),
          changed.to());
    } else if (event instanceof DonorRefundedEvent refunded) {
      log.info(
          "[Funding] Donor refunded: projectId={}, donor={}, native={}",
          refunded.projectId(),
          refunded.donor(),
          refunded.nativeRefunded());
    } else {
      log.info("[Funding] {}", event);
    }
  }
}
