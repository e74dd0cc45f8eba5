package de.example.py2cs.util;

public final class Strings {
  private Strings() {}

  /** Escapes text for a regular C# string literal {@code "..."}. */
  public static String escapeCSharpString(String s) {
    if (s == null) return "";
    StringBuilder sb = new StringBuilder(s.length() + 8);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\0' -> sb.append("\\0");
        default -> {
          // U+0085, U+2028 and U+2029 end a line in C# source
          if (c < 0x20 || c == '\u0085' || c == '\u2028' || c == '\u2029') {
            sb.append(String.format("\\u%04X", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  /** Escapes text for the literal part of an interpolated C# string {@code $"..."}. */
  public static String escapeInterpolated(String s) {
    return escapeCSharpString(s).replace("{", "{{").replace("}", "}}");
  }

  /**
   * Wraps {@code expr} in parentheses unless it already is one parenthesized group,
   * so {@code if (...)} headers do not end up with doubled parentheses.
   */
  public static String parenthesized(String expr) {
    if (expr == null || expr.isBlank()) return "()";
    String e = expr.trim();
    if (e.charAt(0) == '(' && findMatchingParen(e, 0) == e.length() - 1) return e;
    return "(" + e + ")";
  }

  /** Index of the {@code )} closing the {@code (} at {@code openIdx}, skipping string and char literals; -1 if none. */
  public static int findMatchingParen(String s, int openIdx) {
    int depth = 0;
    boolean inStr = false;
    char quote = 0;

    for (int i = openIdx; i < s.length(); i++) {
      char c = s.charAt(i);

      if (inStr) {
        if (c == '\\') { i++; continue; }
        if (c == quote) { inStr = false; quote = 0; }
        continue;
      } else if (c == '"' || c == '\'') {
        inStr = true; quote = c;
        continue;
      }

      if (c == '(') depth++;
      else if (c == ')') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  public static boolean looksLikeTypeName(String n) {
    return n != null && !n.isBlank() && Character.isUpperCase(n.charAt(0));
  }
}
