package ca.gc.cra.units.infrastructure.render;

import ca.gc.cra.units.application.port.GraphRendererPort;
import ca.gc.cra.units.application.port.MetricsPort;
import ca.gc.cra.units.domain.error.LineageRenderException;
import ca.gc.cra.units.domain.error.OptionalDependencyException;
import ca.gc.cra.units.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.units.validation.Numbers;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GraphRendererPort} that pipes DOT source through the Graphviz {@code dot}
 * executable.
 * <p><strong>Role:</strong> Infrastructure adapter; the only component that starts an external process.</p>
 * <p><strong>Concurrency:</strong> Each call starts one process; DOT is written to stdin and stdout and stderr are
 * drained on daemon threads from {@link ExecutorFactories#newDrainPool}. The caller blocks until the process exits
 * or the timeout expires, after which the process is destroyed. The timeout covers feeding the input as well.</p>
 * <p><strong>Observability:</strong> Records {@code lineage.render.latencyNanos} and increments
 * {@code lineage.render.failure} through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class GraphvizProcessRenderer implements GraphRendererPort {
  private static final Logger log = LoggerFactory.getLogger(GraphvizProcessRenderer.class);
  private static final List<String> DEFAULT_COMMAND = List.of("dot", "-Tsvg");

  private final List<String> command;
  private final ExecutorService drainPool;
  private final MetricsPort metrics;

  /**
   * Creates a renderer invoking {@code dot -Tsvg} from the {@code PATH}.
   */
  public GraphvizProcessRenderer() {
    this(DEFAULT_COMMAND, ExecutorFactories.newDrainPool("graphviz-drain", null), MetricsPort.NO_OP);
  }

  /**
   * Creates a renderer with an explicit command line.
   *
   * @param command executable followed by arguments; reads DOT on stdin and writes SVG on stdout
   * @param drainPool executor used to read process output
   * @param metrics metrics sink
   */
  public GraphvizProcessRenderer(List<String> command, ExecutorService drainPool, MetricsPort metrics) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.command = List.copyOf(command);
    this.drainPool = Objects.requireNonNull(drainPool, "drainPool");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public boolean isAvailable() {
    String executable = command.get(0);
    if (executable.indexOf(File.separatorChar) >= 0) {
      return Files.isExecutable(Path.of(executable));
    }
    String path = System.getenv("PATH");
    if (path == null || path.isBlank()) {
      return false;
    }
    for (String directory : path.split(File.pathSeparator)) {
      if (directory.isBlank()) {
        continue;
      }
      Path candidate = Path.of(directory, executable);
      if (Files.isExecutable(candidate) || Files.isExecutable(Path.of(directory, executable + ".exe"))) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String renderSvg(String dot, Duration timeout) {
    Objects.requireNonNull(dot, "dot");
    Numbers.requirePositive("timeout", timeout);
    long started = System.nanoTime();
    Process process;
    try {
      process = new ProcessBuilder(command).start();
    } catch (IOException ex) {
      metrics.increment("lineage.render.failure");
      throw new OptionalDependencyException("graphviz",
          "Unable to start Graphviz renderer '" + command.get(0) + "'; install graphviz to export SVG", ex);
    }
    Future<?> stdin = drainPool.submit(() -> writeAll(process.getOutputStream(), dot));
    Future<String> stdout = drainPool.submit(() -> readAll(process.getInputStream()));
    Future<String> stderr = drainPool.submit(() -> readAll(process.getErrorStream()));
    try {
      if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        throw new LineageRenderException(
            "Graphviz renderer did not finish within " + timeout.toMillis() + " ms");
      }
      int exit = process.exitValue();
      if (exit != 0) {
        String errors = stderr.get(1, TimeUnit.SECONDS).trim();
        throw new LineageRenderException(
            "Graphviz renderer exited with code " + exit + (errors.isEmpty() ? "" : ": " + errors));
      }
      stdin.get(remaining(started, timeout), TimeUnit.NANOSECONDS);
      String svg = stdout.get(remaining(started, timeout), TimeUnit.NANOSECONDS);
      long elapsed = System.nanoTime() - started;
      metrics.observe("lineage.render.latencyNanos", elapsed);
      log.debug("Rendered {} bytes of SVG in {} ms", svg.length(), TimeUnit.NANOSECONDS.toMillis(elapsed));
      return svg;
    } catch (LineageRenderException ex) {
      metrics.increment("lineage.render.failure");
      throw ex;
    } catch (ExecutionException | TimeoutException ex) {
      metrics.increment("lineage.render.failure");
      throw new LineageRenderException("Graphviz rendering failed: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("lineage.render.failure");
      throw new LineageRenderException("Interrupted while waiting for Graphviz renderer", ex);
    } finally {
      if (process.isAlive()) {
        log.warn("Destroying Graphviz renderer process {}", process.pid());
        process.destroyForcibly();
      }
      stdin.cancel(true);
      stdout.cancel(true);
      stderr.cancel(true);
    }
  }

  private static long remaining(long started, Duration timeout) {
    long left = timeout.toNanos() - (System.nanoTime() - started);
    return Math.max(left, TimeUnit.MILLISECONDS.toNanos(100));
  }

  private static Void writeAll(OutputStream stream, String dot) throws IOException {
    try (OutputStream out = stream) {
      out.write(dot.getBytes(StandardCharsets.UTF_8));
    }
    return null;
  }

  private static String readAll(InputStream stream) throws IOException {
    try (InputStream in = stream) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
