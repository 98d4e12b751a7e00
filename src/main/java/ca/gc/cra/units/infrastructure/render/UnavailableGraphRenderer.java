package ca.gc.cra.units.infrastructure.render;

import ca.gc.cra.units.application.port.GraphRendererPort;
import ca.gc.cra.units.domain.error.OptionalDependencyException;
import java.time.Duration;

/**
 * Renderer used when Graphviz is not installed; every render fails with {@link OptionalDependencyException}.
 *
 * @since 0.1.0
 */
public final class UnavailableGraphRenderer implements GraphRendererPort {
  public static final UnavailableGraphRenderer INSTANCE = new UnavailableGraphRenderer();

  private UnavailableGraphRenderer() {}

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public String renderSvg(String dot, Duration timeout) {
    throw new OptionalDependencyException("graphviz",
        "SVG export requires the Graphviz 'dot' executable, which was not found on PATH", null);
  }
}
