package ca.gc.cra.units.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port turning Graphviz DOT text into SVG markup.
 * <p><strong>Why:</strong> Keeps the lineage graph usable when no external renderer is installed.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code GraphvizProcessRenderer} and
 * {@code UnavailableGraphRenderer}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to call from multiple threads; each call is
 * independent.</p>
 *
 * @since 0.1.0
 */
public interface GraphRendererPort {
  /**
   * Indicates whether the renderer can be used on this host.
   *
   * @return {@code true} when {@link #renderSvg(String, Duration)} may succeed
   */
  boolean isAvailable();

  /**
   * Renders DOT source to SVG.
   *
   * @param dot Graphviz DOT source; must not be {@code null}
   * @param timeout upper bound on rendering time; must be positive
   * @return SVG document text
   * @throws ca.gc.cra.units.domain.error.OptionalDependencyException when the renderer is not installed
   * @throws ca.gc.cra.units.domain.error.LineageRenderException when rendering fails or times out
   */
  String renderSvg(String dot, Duration timeout);
}
