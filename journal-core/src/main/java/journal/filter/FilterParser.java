package journal.filter;

import journal.PathFormatException;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer and term parser behind {@link EventFilters#parse(String)}.
 */
final class FilterParser {

  private FilterParser() {}

  static EventFilter parse(String expression) {
    if (expression == null || expression.isBlank()) {
      return EventFilters.all();
    }
    List<EventFilter> filters = new ArrayList<>();
    for (String term : tokenize(expression)) {
      filters.add(parseTerm(term));
    }
    return EventFilters.and(filters);
  }

  private static EventFilter parseTerm(String term) {
    boolean negated = term.startsWith("!");
    String body = negated ? term.substring(1) : term;

    int opIdx = body.indexOf('=');
    if (opIdx <= 0) {
      throw new FilterSyntaxException("Expected KEY=VALUE or KEY~=VALUE, got: " + term);
    }
    boolean containsOp = body.charAt(opIdx - 1) == '~';
    boolean underOp = body.charAt(opIdx - 1) == '^';
    String key = body.substring(0, (containsOp || underOp) ? opIdx - 1 : opIdx);
    String value = unquote(body.substring(opIdx + 1));
    if (key.isEmpty()) {
      throw new FilterSyntaxException("Missing key in term: " + term);
    }

    EventFilter filter;
    try {
      filter = build(key, value, containsOp, underOp, term);
    } catch (PathFormatException e) {
      throw new FilterSyntaxException("Invalid path in term '" + term + "': " + e.getMessage());
    }
    return negated ? filter.negate() : filter;
  }

  private static EventFilter build(String key, String value, boolean containsOp, boolean underOp,
      String term) {
    if (underOp && !key.equals("path")) {
      throw new FilterSyntaxException("'^=' only applies to path: " + term);
    }
    if (key.equals("path")) {
      if (containsOp) {
        throw new FilterSyntaxException("'~=' does not apply to path, use '^=': " + term);
      }
      return underOp ? EventFilters.pathUnder(value) : EventFilters.pathEquals(value);
    }
    if (key.equals("scope")) {
      if (containsOp) {
        throw new FilterSyntaxException("'~=' does not apply to scope: " + term);
      }
      return EventFilters.scopeEquals(value);
    }
    if (key.equals("content")) {
      if (!containsOp) {
        throw new FilterSyntaxException("content only supports '~=': " + term);
      }
      return EventFilters.contentContains(value);
    }
    if (key.equals("has")) {
      if (containsOp) {
        throw new FilterSyntaxException("'~=' does not apply to has: " + term);
      }
      return EventFilters.hasAttribute(value);
    }
    if (key.startsWith("attr.") && key.length() > "attr.".length()) {
      String attribute = key.substring("attr.".length());
      return containsOp
          ? EventFilters.attributeContains(attribute, value)
          : EventFilters.attributeEquals(attribute, value);
    }
    throw new FilterSyntaxException("Unknown filter key '" + key + "' in term: " + term);
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  static List<String> tokenize(String expression) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '"') {
        quoted = !quoted;
        current.append(c);
      } else if (Character.isWhitespace(c) && !quoted) {
        if (current.length() > 0) {
          tokens.add(current.toString());
          current.setLength(0);
        }
      } else {
        current.append(c);
      }
    }
    if (quoted) {
      throw new FilterSyntaxException("Unterminated quote in: " + expression);
    }
    if (current.length() > 0) {
      tokens.add(current.toString());
    }
    return tokens;
  }
}
