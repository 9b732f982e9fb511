package cafe.woden.xmppclient.xmpp;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * Hand-off point between the XMPP transport and the presence subsystem.
 *
 * <p>The transport may publish from any thread; the processor is serialized, so subscribers see
 * events one at a time in publish order.
 */
@Component
@ApplicationLayer
public class XmppEventBus {

  private final FlowableProcessor<XmppEvent> bus = PublishProcessor.<XmppEvent>create().toSerialized();

  public void publish(XmppEvent event) {
    bus.onNext(Objects.requireNonNull(event, "event"));
  }

  public Flowable<XmppEvent> events() {
    return bus.onBackpressureBuffer();
  }
}
