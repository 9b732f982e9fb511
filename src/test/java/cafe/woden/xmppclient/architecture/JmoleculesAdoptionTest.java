package cafe.woden.xmppclient.architecture;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import cafe.woden.xmppclient.app.AutoAwayCoordinator;
import cafe.woden.xmppclient.app.InputActivityTracker;
import cafe.woden.xmppclient.app.PresenceMediator;
import cafe.woden.xmppclient.app.api.IdleTimePort;
import cafe.woden.xmppclient.model.AutoAwayConfig;
import cafe.woden.xmppclient.model.ContactColors;
import cafe.woden.xmppclient.model.ResourcePresence;
import cafe.woden.xmppclient.model.RosterItem;
import cafe.woden.xmppclient.roster.ContactPresenceAggregator;
import cafe.woden.xmppclient.self.SelfPresenceMachine;
import cafe.woden.xmppclient.xmpp.XmppEventBus;
import java.lang.annotation.Annotation;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.jmolecules.ddd.annotation.ValueObject;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.stereotype.Component;

class JmoleculesAdoptionTest {

  @Test
  void layeredMarkersArePresentOnBoundaryTypes() {
    assertAnnotated(ContactPresenceAggregator.class, ApplicationLayer.class);
    assertAnnotated(SelfPresenceMachine.class, ApplicationLayer.class);
    assertAnnotated(XmppEventBus.class, ApplicationLayer.class);
    assertAnnotated(PresenceMediator.class, ApplicationLayer.class);
    assertAnnotated(AutoAwayCoordinator.class, ApplicationLayer.class);
    assertAnnotated(InputActivityTracker.class, ApplicationLayer.class);
    assertAnnotated(IdleTimePort.class, ApplicationLayer.class);

    assertTrue(IdleTimePort.class.isInterface(), "IdleTimePort should remain an interface");
  }

  @Test
  void valueObjectMarkersArePresentOnSharedTypes() {
    assertAnnotated(RosterItem.class, ValueObject.class);
    assertAnnotated(ResourcePresence.class, ValueObject.class);
    assertAnnotated(ContactColors.class, ValueObject.class);
    assertAnnotated(AutoAwayConfig.class, ValueObject.class);
  }

  @Test
  void componentsInFeatureModulesAreApplicationLayerAnnotated() {
    assertComponentPackageAnnotated("cafe.woden.xmppclient.app", ApplicationLayer.class);
    assertComponentPackageAnnotated("cafe.woden.xmppclient.presence", ApplicationLayer.class);
    assertComponentPackageAnnotated("cafe.woden.xmppclient.roster", ApplicationLayer.class);
    assertComponentPackageAnnotated("cafe.woden.xmppclient.self", ApplicationLayer.class);
    assertComponentPackageAnnotated("cafe.woden.xmppclient.xmpp", ApplicationLayer.class);
  }

  private static void assertComponentPackageAnnotated(
      String basePackage, Class<? extends Annotation> marker) {
    ClassPathScanningCandidateComponentProvider scanner =
        new ClassPathScanningCandidateComponentProvider(false);
    scanner.addIncludeFilter(new AnnotationTypeFilter(Component.class));
    var candidates = scanner.findCandidateComponents(basePackage);
    assertTrue(!candidates.isEmpty(), "Expected at least one @Component in " + basePackage);
    for (BeanDefinition candidate : candidates) {
      String className = candidate.getBeanClassName();
      if (className == null || className.isBlank()) {
        fail("Missing bean class name for candidate in " + basePackage);
      }
      try {
        Class<?> type = Class.forName(className);
        assertAnnotated(type, marker);
      } catch (ClassNotFoundException e) {
        fail("Could not load component class " + className, e);
      }
    }
  }

  private static void assertAnnotated(Class<?> type, Class<? extends Annotation> marker) {
    assertTrue(
        type.isAnnotationPresent(marker),
        () -> type.getName() + " must be annotated with @" + marker.getSimpleName());
  }
}
