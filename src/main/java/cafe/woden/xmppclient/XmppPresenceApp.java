package cafe.woden.xmppclient;

import cafe.woden.xmppclient.config.PresenceProperties;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "XmppPresence",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(PresenceProperties.class)
public class XmppPresenceApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(XmppPresenceApp.class).headless(true).run(args);
  }
}
