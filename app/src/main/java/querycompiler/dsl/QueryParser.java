package querycompiler.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses query DSL strings such as {@code from(a).to(b).visited(x).exclude(y)}.
 *
 * <p>Terms may appear in any order; repeated {@code visited}/{@code exclude} clauses merge, while
 * each {@code visitedAny} clause is its own OR group. Whitespace between tokens is ignored.
 */
public final class QueryParser {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]+");

  private final String text;
  private int cursor;

  private QueryParser(String text) {
    this.text = text;
  }

  /** Parses a condition fragment; {@code from}/{@code to} are optional. */
  public static Condition parse(String text) {
    Objects.requireNonNull(text, "text");
    return new QueryParser(text).parseChain();
  }

  /** Parses a full query; both {@code from} and {@code to} are required. */
  public static Condition parseQuery(String text) {
    Condition condition = parse(text);
    if (condition.from() == null) {
      throw new QueryParseException("query requires from(...)", text, 0);
    }
    if (condition.to() == null) {
      throw new QueryParseException("query requires to(...)", text, 0);
    }
    return condition;
  }

  private Condition parseChain() {
    Condition.Builder builder = Condition.builder();
    skipWhitespace();
    if (cursor >= text.length()) {
      return builder.build();
    }
    while (true) {
      parseTerm(builder);
      skipWhitespace();
      if (cursor >= text.length()) {
        return builder.build();
      }
      if (text.charAt(cursor) != '.') {
        throw error("unexpected character", cursor);
      }
      cursor++;
      skipWhitespace();
      if (cursor >= text.length()) {
        throw error("expected function after '.'", cursor - 1);
      }
    }
  }

  private void parseTerm(Condition.Builder builder) {
    int nameStart = cursor;
    while (cursor < text.length() && Character.isLetter(text.charAt(cursor))) {
      cursor++;
    }
    if (cursor == nameStart) {
      throw error("expected function name", nameStart);
    }
    String name = text.substring(nameStart, cursor);
    QueryFunction function =
        QueryFunction.byName(name)
            .orElseThrow(() -> new QueryParseException("unknown function", name, nameStart));
    skipWhitespace();
    if (cursor >= text.length() || text.charAt(cursor) != '(') {
      throw error("expected '(' after " + name, cursor);
    }
    int open = cursor;
    int argsStart = ++cursor;
    while (cursor < text.length() && text.charAt(cursor) != ')') {
      if (text.charAt(cursor) == '(') {
        throw error("unbalanced parentheses", cursor);
      }
      cursor++;
    }
    if (cursor >= text.length()) {
      throw new QueryParseException("unbalanced parentheses", text.substring(open), open);
    }
    String rawArgs = text.substring(argsStart, cursor);
    cursor++;
    if (rawArgs.isBlank()) {
      throw new QueryParseException("empty argument list", name + "()", nameStart);
    }
    apply(builder, function, rawArgs, argsStart, nameStart);
  }

  private void apply(
      Condition.Builder builder, QueryFunction function, String rawArgs, int offset, int at) {
    switch (function) {
      case FROM -> {
        String id = single(rawArgs, offset);
        if (builder.currentFrom() != null && !builder.currentFrom().equals(id)) {
          throw new QueryParseException("conflicting from()", id, offset);
        }
        builder.from(id);
      }
      case TO -> {
        String id = single(rawArgs, offset);
        if (builder.currentTo() != null && !builder.currentTo().equals(id)) {
          throw new QueryParseException("conflicting to()", id, offset);
        }
        builder.to(id);
      }
      case VISITED -> builder.visited(identifiers(rawArgs, offset));
      case VISITED_ANY -> builder.visitedAny(identifiers(rawArgs, offset));
      case EXCLUDE -> builder.exclude(identifiers(rawArgs, offset));
      case MINUS -> builder.minus(identifiers(rawArgs, offset));
      case PLUS -> builder.plus(identifiers(rawArgs, offset));
      case CONTEXT -> parseContext(builder, rawArgs, offset);
      case WINDOW, COHORT -> {
        if (builder.currentDateRange() != null) {
          throw new QueryParseException("only one window or cohort allowed", rawArgs, at);
        }
        DateRange.Mode mode =
            function == QueryFunction.WINDOW ? DateRange.Mode.WINDOW : DateRange.Mode.COHORT;
        builder.dateRange(parseDateRange(mode, rawArgs, offset));
      }
      case CASE -> {
        if (builder.currentCaseFilter() != null) {
          throw new QueryParseException("only one case() allowed", rawArgs, at);
        }
        String[] pair = keyValue(rawArgs.strip(), offset, ':');
        builder.caseFilter(new CaseFilter(pair[0], pair[1]));
      }
    }
  }

  private void parseContext(Condition.Builder builder, String rawArgs, int offset) {
    for (Token token : split(rawArgs, offset)) {
      char separator = token.value().indexOf('=') >= 0 ? '=' : ':';
      String[] pair = keyValue(token.value(), token.position(), separator);
      String existing = builder.currentContext().get(pair[0]);
      if (existing != null && !existing.equals(pair[1])) {
        throw new QueryParseException(
            "conflicting context value for " + pair[0], token.value(), token.position());
      }
      builder.context(pair[0], pair[1]);
    }
  }

  private static DateRange parseDateRange(DateRange.Mode mode, String rawArgs, int offset) {
    String stripped = rawArgs.strip();
    int colon = stripped.indexOf(':');
    if (colon < 0 || stripped.indexOf(':', colon + 1) >= 0) {
      throw new QueryParseException("expected start:end", rawArgs, offset);
    }
    String start = stripped.substring(0, colon).strip();
    String end = stripped.substring(colon + 1).strip();
    if (!DateRange.isValidBound(start)) {
      throw new QueryParseException("invalid date bound", start, offset);
    }
    if (!DateRange.isValidBound(end)) {
      throw new QueryParseException("invalid date bound", end, offset + colon + 1);
    }
    return new DateRange(mode, start, end);
  }

  private static String[] keyValue(String raw, int position, char separator) {
    int split = raw.indexOf(separator);
    if (split <= 0 || split == raw.length() - 1) {
      throw new QueryParseException("expected key" + separator + "value", raw, position);
    }
    String key = raw.substring(0, split).strip();
    String value = raw.substring(split + 1).strip();
    requireIdentifier(key, position);
    requireIdentifier(value, position + split + 1);
    return new String[] {key, value};
  }

  private static String single(String rawArgs, int offset) {
    List<String> ids = identifiers(rawArgs, offset);
    if (ids.size() != 1) {
      throw new QueryParseException("expected a single node id", rawArgs, offset);
    }
    return ids.get(0);
  }

  private static List<String> identifiers(String rawArgs, int offset) {
    List<String> ids = new ArrayList<>();
    for (Token token : split(rawArgs, offset)) {
      requireIdentifier(token.value(), token.position());
      ids.add(token.value());
    }
    return ids;
  }

  private static List<Token> split(String rawArgs, int offset) {
    List<Token> tokens = new ArrayList<>();
    int start = 0;
    for (int i = 0; i <= rawArgs.length(); i++) {
      if (i == rawArgs.length() || rawArgs.charAt(i) == ',') {
        String piece = rawArgs.substring(start, i);
        int lead = 0;
        while (lead < piece.length() && Character.isWhitespace(piece.charAt(lead))) {
          lead++;
        }
        String value = piece.strip();
        if (value.isEmpty()) {
          throw new QueryParseException("empty argument", rawArgs, offset + start);
        }
        tokens.add(new Token(value, offset + start + lead));
        start = i + 1;
      }
    }
    return tokens;
  }

  private static void requireIdentifier(String value, int position) {
    if (!IDENTIFIER.matcher(value).matches()) {
      throw new QueryParseException("invalid identifier", value, position);
    }
  }

  private void skipWhitespace() {
    while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
      cursor++;
    }
  }

  private QueryParseException error(String reason, int position) {
    int end = Math.min(text.length(), position + 10);
    return new QueryParseException(reason, text.substring(Math.max(0, position), end), position);
  }

  private record Token(String value, int position) {}
}
