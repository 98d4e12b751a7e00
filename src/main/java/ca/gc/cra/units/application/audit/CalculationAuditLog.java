package ca.gc.cra.units.application.audit;

import ca.gc.cra.units.application.json.JsonSupport;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.domain.unit.Unit;
import ca.gc.cra.units.domain.unit.UnitRegistry;
import ca.gc.cra.units.validation.Strings;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Ordered record of the named inputs, named outputs and free-text steps of one calculation.
 * <p><strong>Why:</strong> Gives reviewers a single artifact to replay a calculation from, in JSON, CSV or text.</p>
 * <p><strong>Role:</strong> Application aggregate owned by the caller for the lifetime of one calculation; feeds
 * {@code LineageGraph} and {@code UnitFormatter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve insertion order of inputs, outputs and steps in every export.</li>
 *   <li>Overwrite a re-added name in place without moving it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use one log per calculation or synchronize externally.</p>
 *
 * @since 0.1.0
 */
public final class CalculationAuditLog {
  private static final String CSV_HEADER = "role,name,magnitude,unit";

  private final Map<String, TrackedQuantity> inputs = new LinkedHashMap<>();
  private final Map<String, TrackedQuantity> outputs = new LinkedHashMap<>();
  private final List<AuditStep> steps = new ArrayList<>();
  private final Clock clock;

  public CalculationAuditLog() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an empty log.
   *
   * @param clock timestamp source for steps
   */
  public CalculationAuditLog(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records a named input; re-adding a name replaces its value but keeps its position.
   *
   * @param name input name
   * @param quantity input value
   */
  public void addInput(String name, TrackedQuantity quantity) {
    inputs.put(Strings.requireNonBlank("name", name), Objects.requireNonNull(quantity, "quantity"));
  }

  /**
   * Records a named output; re-adding a name replaces its value but keeps its position.
   *
   * @param name output name
   * @param quantity output value
   */
  public void addOutput(String name, TrackedQuantity quantity) {
    outputs.put(Strings.requireNonBlank("name", name), Objects.requireNonNull(quantity, "quantity"));
  }

  /**
   * Appends a step description stamped with the current time.
   *
   * @param description free text
   */
  public void addStep(String description) {
    steps.add(new AuditStep(clock.instant(), Strings.requireNonBlank("description", description)));
  }

  public Map<String, TrackedQuantity> inputs() {
    return Collections.unmodifiableMap(inputs);
  }

  public Map<String, TrackedQuantity> outputs() {
    return Collections.unmodifiableMap(outputs);
  }

  public List<AuditStep> steps() {
    return Collections.unmodifiableList(steps);
  }

  public List<String> inputNames() {
    return List.copyOf(inputs.keySet());
  }

  public List<String> outputNames() {
    return List.copyOf(outputs.keySet());
  }

  /**
   * Returns the inputs expressed in {@code unit}, compared by canonical symbol.
   *
   * @param unit unit text such as {@code meter}; an unresolvable unit matches nothing
   * @return insertion-ordered subset
   */
  public Map<String, TrackedQuantity> filterInputs(String unit) {
    return filter(inputs, unit);
  }

  /**
   * Returns the outputs expressed in {@code unit}, compared by canonical symbol.
   *
   * @param unit unit text; an unresolvable unit matches nothing
   * @return insertion-ordered subset
   */
  public Map<String, TrackedQuantity> filterOutputs(String unit) {
    return filter(outputs, unit);
  }

  private static Map<String, TrackedQuantity> filter(Map<String, TrackedQuantity> source, String unit) {
    UnitRegistry registry = UnitRegistry.getInstance();
    Map<String, TrackedQuantity> matches = new LinkedHashMap<>();
    if (!registry.isDefined(unit)) {
      return matches;
    }
    Unit wanted = registry.resolve(unit);
    source.forEach((name, quantity) -> {
      if (quantity.unit().equals(wanted)) {
        matches.put(name, quantity);
      }
    });
    return matches;
  }

  /**
   * Serializes to {@code {inputs: {name: record}, outputs: {name: record}, steps: [description]}}.
   *
   * @return insertion-ordered map
   */
  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("inputs", records(inputs));
    record.put("outputs", records(outputs));
    List<String> descriptions = new ArrayList<>(steps.size());
    for (AuditStep step : steps) {
      descriptions.add(step.description());
    }
    record.put("steps", descriptions);
    return record;
  }

  private static Map<String, Object> records(Map<String, TrackedQuantity> quantities) {
    Map<String, Object> out = new LinkedHashMap<>();
    quantities.forEach((name, quantity) -> out.put(name, quantity.toRecord()));
    return out;
  }

  public String toJson() {
    return new JsonSupport().write(toRecord());
  }

  /**
   * Exports inputs then outputs as CSV with header {@code role,name,magnitude,unit}.
   *
   * <p>Array magnitudes render as {@code [a;b;c]}. Fields containing a comma, quote or line break are quoted with
   * embedded quotes doubled.</p>
   *
   * @return CSV text, rows separated by {@code \n}
   */
  public String toCsv() {
    StringJoiner lines = new StringJoiner("\n");
    lines.add(CSV_HEADER);
    inputs.forEach((name, quantity) -> lines.add(csvRow("input", name, quantity)));
    outputs.forEach((name, quantity) -> lines.add(csvRow("output", name, quantity)));
    return lines.toString();
  }

  private static String csvRow(String role, String name, TrackedQuantity quantity) {
    return role + ',' + csvField(name) + ',' + csvField(magnitudeText(quantity)) + ','
        + csvField(quantity.unitSymbol());
  }

  /**
   * Renders a magnitude as text: scalars via {@link Double#toString(double)}, arrays as {@code [a;b;c]}.
   *
   * @param quantity quantity to render
   * @return magnitude text
   */
  public static String magnitudeText(TrackedQuantity quantity) {
    if (!quantity.isArray()) {
      return number(quantity.magnitude());
    }
    StringJoiner joiner = new StringJoiner(";", "[", "]");
    for (double value : quantity.magnitudes()) {
      joiner.add(number(value));
    }
    return joiner.toString();
  }

  private static String number(double value) {
    return Double.toString(value);
  }

  private static String csvField(String value) {
    if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0
        && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }

  /**
   * Renders a human-readable listing of every input, output and step.
   *
   * @return multi-line summary
   */
  public String summary() {
    StringJoiner lines = new StringJoiner("\n");
    lines.add("Calculation Audit Log");
    lines.add("  Inputs (" + inputs.size() + "):");
    inputs.forEach((name, quantity) ->
        lines.add("    " + name + ": " + magnitudeText(quantity) + " " + quantity.unitSymbol()));
    lines.add("  Outputs (" + outputs.size() + "):");
    outputs.forEach((name, quantity) ->
        lines.add("    " + name + ": " + magnitudeText(quantity) + " " + quantity.unitSymbol()));
    lines.add("  Steps (" + steps.size() + "):");
    for (AuditStep step : steps) {
      lines.add("    - " + step.description());
    }
    return lines.toString();
  }
}
