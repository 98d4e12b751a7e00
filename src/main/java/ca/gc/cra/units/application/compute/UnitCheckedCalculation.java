package ca.gc.cra.units.application.compute;

import ca.gc.cra.units.domain.quantity.ProvenanceEntry;
import ca.gc.cra.units.domain.quantity.TrackedQuantity;
import ca.gc.cra.units.domain.unit.UnitRegistry;
import ca.gc.cra.units.validation.Numbers;
import ca.gc.cra.units.validation.Strings;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wraps a plain numeric formula so tracked arguments are converted to the units it expects
 * and the result is tracked again.
 * <p><strong>Why:</strong> Legacy formulas work on bare doubles; this keeps them usable while making unit
 * assumptions explicit and preserving provenance across the call.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert each {@link TrackedQuantity} argument with a declared unit, recording the conversion.</li>
 *   <li>Pass raw numbers through unchanged.</li>
 *   <li>Accept scalar quantities only; array-valued arguments are rejected.</li>
 *   <li>Wrap the result in the declared return unit when at least one argument was tracked.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share if the formula is.</p>
 *
 * <pre>{@code
 * UnitCheckedCalculation stress = UnitCheckedCalculation.builder("simple_stress")
 *     .param("force", "N")
 *     .param("area", "m**2")
 *     .returns("Pa")
 *     .build(args -> args.get("force") / args.get("area"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class UnitCheckedCalculation {
  private static final Logger log = LoggerFactory.getLogger(UnitCheckedCalculation.class);

  private final String name;
  private final Map<String, String> parameterUnits;
  private final String returnUnit;
  private final ToDoubleFunction<Map<String, Double>> formula;
  private final Clock clock;

  private UnitCheckedCalculation(Builder builder, ToDoubleFunction<Map<String, Double>> formula) {
    this.name = builder.name;
    this.parameterUnits = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameterUnits));
    this.returnUnit = builder.returnUnit;
    this.formula = formula;
    this.clock = builder.clock;
  }

  /**
   * Starts a builder.
   *
   * @param name calculation name, recorded as the provenance source of results
   * @return builder
   */
  public static Builder builder(String name) {
    return new Builder(Strings.requireNonBlank("name", name));
  }

  public String name() {
    return name;
  }

  /**
   * Runs the formula.
   *
   * <p>Arguments are passed to the formula in the order given. Declared parameters missing from {@code args} are
   * rejected; undeclared arguments pass through.</p>
   *
   * @param args argument name to {@link TrackedQuantity} or {@link Number}
   * @return result, tracked when a return unit is declared and any argument was tracked
   * @throws IllegalArgumentException when a declared parameter is missing, a tracked argument is array-valued, or
   *     an argument is neither tracked nor numeric
   * @throws ca.gc.cra.units.domain.error.DimensionMismatchException when a tracked argument cannot be converted to
   *     its declared unit
   */
  public CalculationResult apply(Map<String, ?> args) {
    Objects.requireNonNull(args, "args");
    for (String parameter : parameterUnits.keySet()) {
      if (!args.containsKey(parameter)) {
        throw new IllegalArgumentException(name + ": missing argument '" + parameter + "'");
      }
    }
    boolean hadTracked = false;
    List<ProvenanceEntry> history = new ArrayList<>();
    Map<String, Double> unwrapped = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : args.entrySet()) {
      String argument = entry.getKey();
      Object value = entry.getValue();
      if (value instanceof TrackedQuantity tracked) {
        if (tracked.isArray()) {
          throw new IllegalArgumentException(
              name + ": argument '" + argument + "' is an array; only scalar quantities are supported");
        }
        hadTracked = true;
        String expected = parameterUnits.get(argument);
        TrackedQuantity prepared = expected == null ? tracked : tracked.to(expected);
        history.addAll(prepared.provenance());
        unwrapped.put(argument, prepared.magnitude());
      } else {
        unwrapped.put(argument, Numbers.requireFinite(name + "." + argument, value));
      }
    }
    double result = formula.applyAsDouble(Collections.unmodifiableMap(unwrapped));
    if (returnUnit == null || !hadTracked) {
      return CalculationResult.raw(result);
    }
    log.debug("{} produced {} {}", name, result, returnUnit);
    TrackedQuantity tracked = TrackedQuantity.create(result, returnUnit, name, clock).withPriorProvenance(history);
    return CalculationResult.tracked(tracked);
  }

  /**
   * Collects parameter units and the return unit of a {@link UnitCheckedCalculation}.
   */
  public static final class Builder {
    private final String name;
    private final Map<String, String> parameterUnits = new LinkedHashMap<>();
    private String returnUnit;
    private Clock clock = Clock.systemUTC();

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Declares the unit a parameter must be converted to before the formula runs.
     *
     * @param parameter argument name
     * @param unit unit text resolvable by the registry
     * @return this builder
     * @throws ca.gc.cra.units.domain.error.UnknownUnitException when the unit is unknown
     */
    public Builder param(String parameter, String unit) {
      String key = Strings.requireNonBlank("parameter", parameter);
      UnitRegistry.getInstance().resolve(unit);
      parameterUnits.put(key, unit);
      return this;
    }

    /**
     * Declares the unit attached to tracked results.
     *
     * @param unit unit text resolvable by the registry
     * @return this builder
     */
    public Builder returns(String unit) {
      UnitRegistry.getInstance().resolve(unit);
      this.returnUnit = unit;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Builds the calculation.
     *
     * @param formula body receiving unwrapped magnitudes by argument name
     * @return calculation
     */
    public UnitCheckedCalculation build(ToDoubleFunction<Map<String, Double>> formula) {
      return new UnitCheckedCalculation(this, Objects.requireNonNull(formula, "formula"));
    }
  }
}
