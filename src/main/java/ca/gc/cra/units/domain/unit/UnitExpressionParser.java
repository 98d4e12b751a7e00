package ca.gc.cra.units.domain.unit;

import ca.gc.cra.units.domain.error.UnknownUnitException;
import java.util.function.Function;

/**
 * Recursive-descent parser for unit expressions.
 *
 * <pre>
 * expression := power (('*' | '/') power)*
 * power      := primary (('**' | '^') integer)?
 * primary    := symbol | '1' | '(' expression ')'
 * </pre>
 *
 * <p>Not thread-safe; create one instance per expression.</p>
 */
final class UnitExpressionParser {
  private final String text;
  private final Function<String, Unit> symbols;
  private int pos;

  UnitExpressionParser(String text, Function<String, Unit> symbols) {
    this.text = text;
    this.symbols = symbols;
  }

  Unit parse() {
    skipSpaces();
    if (pos >= text.length()) {
      throw new UnknownUnitException(text, "Unit string must not be blank");
    }
    Unit unit = expression();
    skipSpaces();
    if (pos < text.length()) {
      throw malformed();
    }
    return unit;
  }

  private Unit expression() {
    Unit result = power();
    while (true) {
      skipSpaces();
      if (pos >= text.length()) {
        return result;
      }
      char c = text.charAt(pos);
      if (c == '*' && !text.startsWith("**", pos)) {
        pos++;
        result = result.times(power());
      } else if (c == '/') {
        pos++;
        result = result.dividedBy(power());
      } else {
        return result;
      }
    }
  }

  private Unit power() {
    Unit base = primary();
    skipSpaces();
    if (text.startsWith("**", pos)) {
      pos += 2;
      return base.pow(integer());
    }
    if (pos < text.length() && text.charAt(pos) == '^') {
      pos++;
      return base.pow(integer());
    }
    return base;
  }

  private Unit primary() {
    skipSpaces();
    if (pos >= text.length()) {
      throw malformed();
    }
    char c = text.charAt(pos);
    if (c == '(') {
      pos++;
      Unit inner = expression();
      skipSpaces();
      if (pos >= text.length() || text.charAt(pos) != ')') {
        throw malformed();
      }
      pos++;
      return inner;
    }
    if (c == '1') {
      pos++;
      return Unit.DIMENSIONLESS;
    }
    if (!isSymbolStart(c)) {
      throw malformed();
    }
    int start = pos;
    while (pos < text.length() && isSymbolPart(text.charAt(pos))) {
      pos++;
    }
    return symbols.apply(text.substring(start, pos));
  }

  private int integer() {
    skipSpaces();
    int start = pos;
    if (pos < text.length() && (text.charAt(pos) == '-' || text.charAt(pos) == '+')) {
      pos++;
    }
    while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
      pos++;
    }
    try {
      return Integer.parseInt(text.substring(start, pos));
    } catch (NumberFormatException ex) {
      throw new UnknownUnitException(text, "Malformed exponent in unit '" + text + "'");
    }
  }

  private void skipSpaces() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private UnknownUnitException malformed() {
    return new UnknownUnitException(text, "Malformed unit expression '" + text + "' at position " + pos);
  }

  private static boolean isSymbolStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '°';
  }

  private static boolean isSymbolPart(char c) {
    return isSymbolStart(c) || Character.isDigit(c);
  }
}
