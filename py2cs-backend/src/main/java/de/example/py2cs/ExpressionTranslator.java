package de.example.py2cs;

import de.example.py2cs.ast.*;
import de.example.py2cs.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders Python expressions as C# expression text.
 *
 * <p>Every compound expression is parenthesized. Unsupported kinds come back as an inline
 * comment marker naming the kind and are recorded in the context.
 */
public final class ExpressionTranslator {
  private static final Logger log = LoggerFactory.getLogger(ExpressionTranslator.class);

  /** Builtins that become a LINQ / collection method on their first argument. */
  private static final Set<String> RECEIVER_BUILTINS = Set.of("len", "sum", "max", "min", "any", "all");

  /** Python ints beyond the range of {@code long}. */
  static final String BIG_INTEGER = "System.Numerics.BigInteger";

  /** Largest tuple still rendered as a C# tuple literal. */
  static final int MAX_TUPLE_ARITY = 8;

  private final MappingTables tables;

  public ExpressionTranslator(MappingTables tables) {
    this.tables = tables;
  }

  public String toCSharp(Expr e, TranslationContext ctx) {
    if (e == null) return "null";

    if (e instanceof Constant c) return constant(c);
    if (e instanceof NameRef n) return name(n, ctx);
    if (e instanceof BinaryOp b) return binary(b, ctx);
    if (e instanceof UnaryOp u) return "(" + unarySymbol(u.op()) + toCSharp(u.operand(), ctx) + ")";
    if (e instanceof Compare c) return compare(c, ctx);
    if (e instanceof BoolOp b) return boolOp(b, ctx);
    if (e instanceof Call c) return call(c, ctx);
    if (e instanceof Attribute a) return toCSharp(a.value(), ctx) + "." + a.attr();
    if (e instanceof Subscript s) return subscript(s, ctx);
    if (e instanceof ListLiteral l) return "new List<object>" + initializer(l.elts(), ctx);
    if (e instanceof SetLiteral s) return "new HashSet<object>" + initializer(s.elts(), ctx);
    if (e instanceof DictLiteral d) return dict(d, ctx);
    if (e instanceof TupleLiteral t) return tuple(t, ctx);
    if (e instanceof ListComprehension lc) return listComprehension(lc, ctx);
    if (e instanceof DictComprehension dc) return dictComprehension(dc, ctx);
    if (e instanceof SetComprehension sc) return setComprehension(sc, ctx);
    if (e instanceof InterpolatedString s) return interpolated(s, ctx);
    if (e instanceof InterpolationSlot slot) return slot(slot, ctx);

    // Slice outside a subscript, UnsupportedExpr
    return unsupported(e.kind(), null, ctx);
  }

  /** Comma-joined call arguments: positional first, then keywords as C# named arguments. */
  public String arguments(Call c, TranslationContext ctx) {
    List<String> parts = render(c.args(), ctx);
    parts.addAll(keywords(c.keywords(), ctx));
    return String.join(", ", parts);
  }

  /** C# symbol of a binary operator, for {@code a op b} and {@code a op= b}. */
  public String binarySymbol(BinaryOperator op) {
    return switch (op) {
      case ADD -> "+";
      case SUB -> "-";
      case MULT -> "*";
      case DIV, FLOOR_DIV -> "/";
      case MOD -> "%";
      case LSHIFT -> "<<";
      case RSHIFT -> ">>";
      case BIT_OR -> "|";
      case BIT_XOR -> "^";
      case BIT_AND -> "&";
      case POW, MAT_MULT -> throw new UnsupportedConstructException("operator " + op.pythonName() + " has no C# symbol");
    };
  }

  /** {@code -3}, {@code -2.5} or {@code -(3)} as a literal. */
  static boolean isNegativeNumber(Expr e) {
    if (e instanceof Constant c && c.value() instanceof Number n) {
      return signum(n) < 0;
    }
    if (e instanceof UnaryOp u && u.op() == UnaryOperator.USUB
        && u.operand() instanceof Constant c && c.value() instanceof Number n) {
      return signum(n) > 0;
    }
    return false;
  }

  // =========================================================
  // Atoms
  // =========================================================
  private String constant(Constant c) {
    Object v = c.value();
    if (v == null) return "null";
    if (v instanceof String s) return "\"" + Strings.escapeCSharpString(s) + "\"";
    if (v instanceof Boolean b) return b ? "true" : "false";
    if (v instanceof BigInteger big && big.bitLength() > 63) {
      return BIG_INTEGER + ".Parse(\"" + big + "\")";
    }
    if (v instanceof Double d) {
      if (d.isNaN()) return "double.NaN";
      if (d.isInfinite()) return d > 0 ? "double.PositiveInfinity" : "double.NegativeInfinity";
    }
    return v.toString();
  }

  private String name(NameRef n, TranslationContext ctx) {
    if (ctx.inClass() && n.id().equals("self")) return "this";
    return tables.type(n.id());
  }

  // =========================================================
  // Operators
  // =========================================================
  private String binary(BinaryOp b, TranslationContext ctx) {
    if (b.op() == BinaryOperator.MAT_MULT) return unsupported("BinaryOp", "MatMult", ctx);

    String left = toCSharp(b.left(), ctx);
    String right = toCSharp(b.right(), ctx);
    if (b.op() == BinaryOperator.POW) return "Math.Pow(" + left + ", " + right + ")";
    return "(" + left + " " + binarySymbol(b.op()) + " " + right + ")";
  }

  private String unarySymbol(UnaryOperator op) {
    return switch (op) {
      case UADD -> "+";
      case USUB -> "-";
      case NOT -> "!";
      case INVERT -> "~";
    };
  }

  // a < b < c  =>  ((a < b) && (b < c))
  private String compare(Compare c, TranslationContext ctx) {
    List<String> pairs = new ArrayList<>();
    String left = toCSharp(c.left(), ctx);
    for (int i = 0; i < c.ops().size(); i++) {
      String right = toCSharp(c.comparators().get(i), ctx);
      pairs.add(comparePair(left, c.ops().get(i), right));
      left = right;
    }
    return pairs.size() == 1 ? pairs.get(0) : "(" + String.join(" && ", pairs) + ")";
  }

  private String comparePair(String left, CompareOperator op, String right) {
    return switch (op) {
      case EQ, IS -> "(" + left + " == " + right + ")";
      case NOT_EQ, IS_NOT -> "(" + left + " != " + right + ")";
      case LT -> "(" + left + " < " + right + ")";
      case LT_E -> "(" + left + " <= " + right + ")";
      case GT -> "(" + left + " > " + right + ")";
      case GT_E -> "(" + left + " >= " + right + ")";
      case IN -> right + ".Contains(" + left + ")";
      case NOT_IN -> "(!" + right + ".Contains(" + left + "))";
    };
  }

  private String boolOp(BoolOp b, TranslationContext ctx) {
    if (b.values().isEmpty()) return unsupported("BoolOp", "no operands", ctx);
    String op = b.op() == BoolOperator.AND ? " && " : " || ";
    return "(" + String.join(op, render(b.values(), ctx)) + ")";
  }

  // =========================================================
  // Calls
  // =========================================================
  private String call(Call c, TranslationContext ctx) {
    if (c.func() instanceof NameRef n && tables.isBuiltin(n.id())) {
      return builtinCall(n.id(), c, ctx);
    }

    if (c.func() instanceof Attribute a) {
      return toCSharp(a.value(), ctx) + "." + tables.method(a.attr()) + "(" + arguments(c, ctx) + ")";
    }

    return toCSharp(c.func(), ctx) + "(" + arguments(c, ctx) + ")";
  }

  private String builtinCall(String name, Call c, TranslationContext ctx) {
    String mapped = tables.builtin(name);

    if (name.equals("print")) {
      return mapped + "(" + arguments(c, ctx) + ")";
    }

    if (RECEIVER_BUILTINS.contains(name)) {
      List<String> args = render(c.args(), ctx);
      args.addAll(keywords(c.keywords(), ctx));
      if (args.isEmpty()) return mapped + "()";
      return args.get(0) + "." + mapped + "(" + String.join(", ", args.subList(1, args.size())) + ")";
    }

    if (name.equals("range")) {
      return range(c, ctx);
    }

    return mapped + "(" + arguments(c, ctx) + ")";
  }

  // range(n) / range(a, b) / range(a, b, s); same start/end/step defaults as the counted for-loop
  private String range(Call c, TranslationContext ctx) {
    if (c.args().size() == 3 && isNegativeNumber(c.args().get(2))) {
      return countdown(c.args(), ctx);
    }
    List<String> a = render(c.args(), ctx);
    return switch (a.size()) {
      case 1 -> "Enumerable.Range(0, " + a.get(0) + ")";
      case 2 -> "Enumerable.Range(" + a.get(0) + ", (" + a.get(1) + " - " + a.get(0) + "))";
      case 3 -> "Enumerable.Range(" + a.get(0) + ", (" + a.get(1) + " - " + a.get(0) + "))"
          + ".Where((x, i) => i % " + a.get(2) + " == 0)";
      default -> unsupported("Call", "range with " + a.size() + " arguments", ctx);
    };
  }

  // range(a, b, -m) => m-strided countdown from a, stopping before b; empty when a <= b
  private String countdown(List<Expr> args, TranslationContext ctx) {
    String start = toCSharp(args.get(0), ctx);
    String end = toCSharp(args.get(1), ctx);
    Expr step = args.get(2);
    String m = step instanceof UnaryOp u ? toCSharp(u.operand(), ctx) : toCSharp(step, ctx).substring(1);

    return "Enumerable.Range(0, Math.Max(0, (" + start + " - " + end + " + " + m + " - 1) / " + m + "))"
        + ".Select(k => " + start + " - k * " + m + ")";
  }

  private List<String> keywords(List<Keyword> keywords, TranslationContext ctx) {
    List<String> out = new ArrayList<>();
    for (Keyword k : keywords) {
      if (k.arg() == null) {
        out.add(unsupported("Keyword", "** unpacking", ctx));
      } else {
        out.add(k.arg() + ": " + toCSharp(k.value(), ctx));
      }
    }
    return out;
  }

  // =========================================================
  // Subscripts
  // =========================================================
  private String subscript(Subscript s, TranslationContext ctx) {
    if (s.slice() instanceof Slice sl) return slice(s.value(), sl, ctx);
    return toCSharp(s.value(), ctx) + "[" + toCSharp(s.slice(), ctx) + "]";
  }

  // xs[lo:hi:step] => xs.Skip(lo).Take(hi - lo)[.Where((x, i) => i % step == 0)]
  private String slice(Expr value, Slice sl, TranslationContext ctx) {
    if (isNegativeNumber(sl.lower()) || isNegativeNumber(sl.upper())) {
      return unsupported("Slice", "negative bound", ctx);
    }
    if (isNegativeNumber(sl.step())) {
      return unsupported("Slice", "negative step", ctx);
    }
    // xs[:] / xs[::k]: copy or stride of the whole sequence, no C# counterpart picked
    if (sl.lower() == null && sl.upper() == null) {
      return unsupported("Slice", "no bounds", ctx);
    }

    String recv = toCSharp(value, ctx);
    String lower = sl.lower() == null ? "0" : toCSharp(sl.lower(), ctx);
    String upper = sl.upper() == null ? recv + ".Count" : toCSharp(sl.upper(), ctx);
    String count = sl.lower() == null ? upper : upper + " - " + lower;

    String out = recv + ".Skip(" + lower + ").Take(" + count + ")";
    if (sl.step() != null) {
      out += ".Where((x, i) => i % " + toCSharp(sl.step(), ctx) + " == 0)";
    }
    return out;
  }

  // =========================================================
  // Collection literals
  // =========================================================
  private String initializer(List<Expr> elts, TranslationContext ctx) {
    if (elts.isEmpty()) return "()";
    return " { " + String.join(", ", render(elts, ctx)) + " }";
  }

  private String dict(DictLiteral d, TranslationContext ctx) {
    if (d.keys().isEmpty()) return "new Dictionary<object, object>()";

    List<String> entries = new ArrayList<>();
    for (int i = 0; i < d.keys().size(); i++) {
      Expr key = d.keys().get(i);
      if (key == null) {
        entries.add(unsupported("DictLiteral", "** unpacking", ctx));
        continue;
      }
      entries.add("[" + toCSharp(key, ctx) + "] = " + toCSharp(d.values().get(i), ctx));
    }
    return "new Dictionary<object, object> { " + String.join(", ", entries) + " }";
  }

  private String tuple(TupleLiteral t, TranslationContext ctx) {
    List<String> elts = render(t.elts(), ctx);
    if (elts.size() < 2) return "ValueTuple.Create(" + String.join(", ", elts) + ")";
    if (elts.size() <= MAX_TUPLE_ARITY) return "(" + String.join(", ", elts) + ")";
    return "new object[] { " + String.join(", ", elts) + " }";
  }

  // =========================================================
  // Comprehensions (LINQ)
  // =========================================================
  private record Source(String variable, String query) {}

  /** {@code iter[.Where(v => c1 && c2)]} for the first generator; further generators are dropped. */
  private Source source(String kind, List<Comprehension> generators, TranslationContext ctx) {
    Comprehension g = generators.get(0);
    if (generators.size() > 1) {
      log.warn("{}: only the first of {} for-clauses is translated", kind, generators.size());
      ctx.reportUnsupported(kind + " (nested for-clause)");
    }

    String var = g.target() instanceof NameRef n ? n.id() : "x";
    String query = toCSharp(g.iter(), ctx);

    if (!g.ifs().isEmpty()) {
      List<String> conds = render(g.ifs(), ctx);
      String cond = conds.size() == 1 ? conds.get(0) : "(" + String.join(" && ", conds) + ")";
      query += ".Where(" + var + " => " + cond + ")";
    }
    return new Source(var, query);
  }

  private String listComprehension(ListComprehension lc, TranslationContext ctx) {
    Source src = source("ListComprehension", lc.generators(), ctx);
    return src.query() + ".Select(" + src.variable() + " => " + toCSharp(lc.elt(), ctx) + ").ToList()";
  }

  private String dictComprehension(DictComprehension dc, TranslationContext ctx) {
    Source src = source("DictComprehension", dc.generators(), ctx);
    String v = src.variable();
    return src.query() + ".ToDictionary("
        + v + " => " + toCSharp(dc.key(), ctx) + ", "
        + v + " => " + toCSharp(dc.value(), ctx) + ")";
  }

  private String setComprehension(SetComprehension sc, TranslationContext ctx) {
    Source src = source("SetComprehension", sc.generators(), ctx);
    return "new HashSet<object>(" + src.query() + ".Select(" + src.variable() + " => " + toCSharp(sc.elt(), ctx) + "))";
  }

  // =========================================================
  // f-strings
  // =========================================================
  private String interpolated(InterpolatedString s, TranslationContext ctx) {
    StringBuilder sb = new StringBuilder("$\"");
    for (Expr part : s.values()) {
      if (part instanceof Constant c && c.isString()) {
        sb.append(Strings.escapeInterpolated((String) c.value()));
      } else if (part instanceof InterpolationSlot slot) {
        sb.append(slot(slot, ctx));
      } else {
        sb.append("{").append(toCSharp(part, ctx)).append("}");
      }
    }
    return sb.append("\"").toString();
  }

  // {value:spec}; !r / !s / !a conversions have no C# counterpart and are dropped
  private String slot(InterpolationSlot slot, TranslationContext ctx) {
    String value = toCSharp(slot.value(), ctx);
    if (slot.formatSpec() == null) return "{" + value + "}";

    String spec = constantFormatSpec(slot.formatSpec());
    if (spec == null) {
      log.warn("InterpolationSlot: nested interpolation in format spec is not supported");
      ctx.reportUnsupported("InterpolationSlot (nested format spec)");
      return "{" + value + "}";
    }
    return spec.isEmpty() ? "{" + value + "}" : "{" + value + ":" + spec + "}";
  }

  private String constantFormatSpec(Expr spec) {
    if (spec instanceof Constant c && c.isString()) return (String) c.value();
    if (!(spec instanceof InterpolatedString s)) return null;

    StringBuilder sb = new StringBuilder();
    for (Expr part : s.values()) {
      if (!(part instanceof Constant c && c.isString())) return null;
      sb.append((String) c.value());
    }
    return sb.toString();
  }

  // =========================================================
  // Helpers
  // =========================================================
  private List<String> render(List<Expr> exprs, TranslationContext ctx) {
    return exprs.stream().map(x -> toCSharp(x, ctx)).collect(Collectors.toCollection(ArrayList::new));
  }

  private String unsupported(String kind, String detail, TranslationContext ctx) {
    String what = detail == null ? kind : kind + " (" + detail + ")";
    log.warn("Unsupported expression: {}", what);
    ctx.reportUnsupported(what);
    return "/* Unsupported expression: " + what + " */";
  }

  private static int signum(Number n) {
    if (n instanceof BigInteger b) return b.signum();
    if (n instanceof BigDecimal b) return b.signum();
    return Double.compare(n.doubleValue(), 0.0);
  }
}
