@NamedInterface("api")
package cafe.woden.xmppclient.app.api;

import org.springframework.modulith.NamedInterface;
