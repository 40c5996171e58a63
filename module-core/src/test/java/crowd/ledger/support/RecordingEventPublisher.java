package crowd.ledger.support;

import crowd.ledger.core.event.FundingEvent;
import crowd.ledger.core.port.out.FundingEventPublisher;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.List;

public class RecordingEventPublisher implements FundingEventPublisher {

  private final List<FundingEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void publish(FundingEvent event) {
    events.add(event);
  }

  public <T extends FundingEvent> List<T> eventsOf(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast).toList();
  }

  public List<FundingEvent> events() {
    return events;
  }
}
