package cafe.woden.xmppclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/** Badge colors for one identity, as {@code #rrggbb} for light and dark themes. */
@ValueObject
public record ContactColors(String colorLight, String colorDark) {}
