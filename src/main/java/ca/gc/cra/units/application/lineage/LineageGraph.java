package ca.gc.cra.units.application.lineage;

import ca.gc.cra.units.application.audit.AuditStep;
import ca.gc.cra.units.application.audit.CalculationAuditLog;
import ca.gc.cra.units.application.json.JsonSupport;
import ca.gc.cra.units.application.port.GraphRendererPort;
import ca.gc.cra.units.domain.error.OptionalDependencyException;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.validation.Numbers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Read-only directed graph of the inputs and outputs of a {@link CalculationAuditLog}.
 * <p><strong>Why:</strong> Gives reviewers a picture of which values fed which results.</p>
 * <p><strong>Role:</strong> Derived view built once from a completed log; exports to maps, JSON, DOT, HTML and
 * SVG.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @implNote The audit log keeps steps as a flat list without operand names, so every step links every input to
 *     every output. Multi-step, multi-output calculations therefore over-connect.
 * @since 0.1.0
 */
public final class LineageGraph {
  private static final Logger log = LoggerFactory.getLogger(LineageGraph.class);

  private final List<LineageNode> nodes;
  private final List<LineageEdge> edges;

  private LineageGraph(List<LineageNode> nodes, List<LineageEdge> edges) {
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
  }

  /**
   * Builds the graph: one node per input and output, and for each step one edge from every input to every
   * output.
   *
   * @param auditLog completed log
   * @return graph
   */
  public static LineageGraph fromAuditLog(CalculationAuditLog auditLog) {
    Objects.requireNonNull(auditLog, "auditLog");
    List<LineageNode> nodes = new ArrayList<>();
    auditLog.inputs().forEach((name, quantity) -> nodes.add(node(name, quantity, NodeRole.INPUT)));
    auditLog.outputs().forEach((name, quantity) -> nodes.add(node(name, quantity, NodeRole.OUTPUT)));
    List<LineageEdge> edges = new ArrayList<>();
    for (AuditStep step : auditLog.steps()) {
      for (String input : auditLog.inputNames()) {
        for (String output : auditLog.outputNames()) {
          edges.add(new LineageEdge(input, output, step.description()));
        }
      }
    }
    return new LineageGraph(nodes, edges);
  }

  private static LineageNode node(String name, TrackedQuantity quantity, NodeRole role) {
    Object value;
    if (quantity.isArray()) {
      List<Double> values = new ArrayList<>();
      for (double magnitude : quantity.magnitudes()) {
        values.add(magnitude);
      }
      value = List.copyOf(values);
    } else {
      value = quantity.magnitude();
    }
    return new LineageNode(name, value, CalculationAuditLog.magnitudeText(quantity), quantity.unitSymbol(), role);
  }

  public List<LineageNode> nodes() {
    return nodes;
  }

  public List<LineageEdge> edges() {
    return edges;
  }

  /**
   * Serializes to {@code {nodes: [{name, value, unit, role}], edges: [{source, target, operation}]}}.
   *
   * @return insertion-ordered map
   */
  public Map<String, Object> toDict() {
    List<Map<String, Object>> nodeRecords = new ArrayList<>(nodes.size());
    for (LineageNode node : nodes) {
      nodeRecords.add(node.toRecord());
    }
    List<Map<String, Object>> edgeRecords = new ArrayList<>(edges.size());
    for (LineageEdge edge : edges) {
      edgeRecords.add(edge.toRecord());
    }
    Map<String, Object> dict = new LinkedHashMap<>();
    dict.put("nodes", nodeRecords);
    dict.put("edges", edgeRecords);
    return dict;
  }

  public String toJson() {
    return new JsonSupport().write(toDict());
  }

  /**
   * Exports Graphviz DOT. Inputs are ellipses, outputs boxes; repeated source/target pairs keep only the first
   * step label.
   *
   * @return DOT source
   */
  public String toDot() {
    StringJoiner lines = new StringJoiner("\n");
    lines.add("digraph lineage {");
    lines.add("  rankdir=LR;");
    for (LineageNode node : nodes) {
      String shape = node.role() == NodeRole.INPUT ? "ellipse" : "box";
      String label = dotEscape(node.name()) + "\\n" + dotEscape(node.valueText() + " " + node.unit());
      lines.add("  \"" + dotEscape(node.name()) + "\" [label=\"" + label + "\", shape=" + shape + "];");
    }
    Set<List<String>> seen = new HashSet<>();
    for (LineageEdge edge : edges) {
      if (seen.add(List.of(edge.source(), edge.target()))) {
        lines.add("  \"" + dotEscape(edge.source()) + "\" -> \"" + dotEscape(edge.target())
            + "\" [label=\"" + dotEscape(edge.operation()) + "\"];");
      }
    }
    lines.add("}");
    return lines.toString();
  }

  /**
   * Renders a self-contained HTML report with a Quantities table and a Computation Steps table.
   *
   * @return HTML document without scripts or external resources
   */
  public String toHtml() {
    StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n")
        .append("<title>Calculation Lineage</title>\n")
        .append("<style>table{border-collapse:collapse;margin-bottom:1em}")
        .append("th,td{border:1px solid #999;padding:4px 8px;text-align:left}</style>\n")
        .append("</head>\n<body>\n<h1>Calculation Lineage</h1>\n");
    html.append("<h2>Quantities</h2>\n<table>\n<tr><th>Name</th><th>Value</th><th>Unit</th><th>Role</th></tr>\n");
    for (LineageNode node : nodes) {
      html.append("<tr><td>").append(htmlEscape(node.name()))
          .append("</td><td>").append(htmlEscape(node.valueText()))
          .append("</td><td>").append(htmlEscape(node.unit()))
          .append("</td><td>").append(node.role().wireName())
          .append("</td></tr>\n");
    }
    html.append("</table>\n");
    html.append("<h2>Computation Steps</h2>\n<table>\n")
        .append("<tr><th>Source</th><th>Target</th><th>Operation</th></tr>\n");
    for (LineageEdge edge : edges) {
      html.append("<tr><td>").append(htmlEscape(edge.source()))
          .append("</td><td>").append(htmlEscape(edge.target()))
          .append("</td><td>").append(htmlEscape(edge.operation()))
          .append("</td></tr>\n");
    }
    html.append("</table>\n</body>\n</html>\n");
    return html.toString();
  }

  /**
   * Renders the DOT export to SVG through an external renderer.
   *
   * @param renderer renderer adapter, e.g. from {@code GraphRenderers.detect()}
   * @param timeout upper bound on rendering time
   * @return SVG markup
   * @throws OptionalDependencyException when the renderer is not installed
   * @throws ca.gc.cra.units.domain.error.LineageRenderException when rendering fails or times out
   */
  public String toSvg(GraphRendererPort renderer, Duration timeout) {
    Objects.requireNonNull(renderer, "renderer");
    Numbers.requirePositive("timeout", timeout);
    if (!renderer.isAvailable()) {
      throw new OptionalDependencyException("graphviz",
          "SVG export requires the Graphviz 'dot' executable; install graphviz or use toHtml()", null);
    }
    log.debug("Rendering lineage graph with {} nodes and {} edges to SVG", nodes.size(), edges.size());
    return renderer.renderSvg(toDot(), timeout);
  }

  private static String dotEscape(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }

  private static String htmlEscape(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '&' -> out.append("&amp;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
