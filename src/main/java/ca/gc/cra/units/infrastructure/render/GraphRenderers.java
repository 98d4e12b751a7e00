package ca.gc.cra.units.infrastructure.render;

import ca.gc.cra.units.application.port.GraphRendererPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the graph renderer available on this host.
 *
 * @since 0.1.0
 */
public final class GraphRenderers {
  private static final Logger log = LoggerFactory.getLogger(GraphRenderers.class);

  private GraphRenderers() {}

  /**
   * Returns a Graphviz renderer when {@code dot} is on the {@code PATH}, otherwise
   * {@link UnavailableGraphRenderer#INSTANCE}.
   *
   * @return renderer
   */
  public static GraphRendererPort detect() {
    GraphvizProcessRenderer graphviz = new GraphvizProcessRenderer();
    if (graphviz.isAvailable()) {
      log.info("Graphviz renderer detected on PATH");
      return graphviz;
    }
    log.warn("Graphviz 'dot' not found on PATH; SVG lineage export disabled");
    return UnavailableGraphRenderer.INSTANCE;
  }
}
