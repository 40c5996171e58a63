package crowd.ledger.core.project;

import crowd.ledger.core.port.out.AssetDirectory;
import crowd.ledger.core.port.out.FundingEventPublisher;
import crowd.ledger.core.port.out.NativeAssetLedger;
import crowd.ledger.core.port.out.SecondaryEffectDispatcher;
import crowd.ledger.domain.model.account.Address;
import java.time.Clock;
import java.util.Objects;

/** 공유 협력자를 주입받아 독립된 {@link ProjectEscrow}를 만드는 기본 템플릿 */
public class DefaultProjectFactory implements ProjectFactory {

  private final NativeAssetLedger nativeLedger;
  private final AssetDirectory assetDirectory;
  private final SecondaryEffectDispatcher dispatcher;
  private final FundingEventPublisher eventPublisher;
  private final Clock clock;

  public DefaultProjectFactory(
      NativeAssetLedger nativeLedger,
      AssetDirectory assetDirectory,
      SecondaryEffectDispatcher dispatcher,
      FundingEventPublisher eventPublisher,
      Clock clock) {
    this.nativeLedger = Objects.requireNonNull(nativeLedger, "nativeLedger");
    this.assetDirectory = Objects.requireNonNull(assetDirectory, "assetDirectory");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ProjectEscrow newInstance(Address instanceAddress) {
    return new ProjectEscrow(
        instanceAddress, nativeLedger, assetDirectory, dispatcher, eventPublisher, clock);
  }
}
