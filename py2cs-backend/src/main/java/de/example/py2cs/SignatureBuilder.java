package de.example.py2cs;

import de.example.py2cs.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Builds C# constructor and method header lines for a {@link FunctionDef}. */
public final class SignatureBuilder {
  private static final Set<String> STATIC_DECORATORS = Set.of("staticmethod", "classmethod");

  private final TypeMapper typeMapper;
  private final ExpressionTranslator expr;

  public SignatureBuilder(TypeMapper typeMapper, ExpressionTranslator expr) {
    this.typeMapper = typeMapper;
    this.expr = expr;
  }

  /** {@code public ClassName(params)} for {@code __init__}. */
  public String buildConstructorLine(String className, FunctionDef f, TranslationContext ctx) {
    return "public " + className + "(" + buildParameterList(f.params(), true, ctx) + ")";
  }

  /**
   * {@code public [static] <ret> name(params)}. Module-level functions are static members of the
   * synthesized container; {@code @staticmethod}/{@code @classmethod} make class members static.
   */
  public String buildMethodLine(FunctionDef f, TranslationContext ctx) {
    boolean isStatic = !ctx.inClass() || isStaticDecorated(f);
    boolean dropReceiver = ctx.inClass() && !hasDecorator(f, "staticmethod");

    StringBuilder sb = new StringBuilder("public ");
    if (isStatic) sb.append("static ");
    sb.append(returnType(f)).append(' ').append(f.name());
    sb.append('(').append(buildParameterList(f.params(), dropReceiver, ctx)).append(')');
    return sb.toString();
  }

  /** {@code <type> <name>[ = default]}, comma-joined. */
  public String buildParameterList(List<Parameter> params, boolean dropReceiver, TranslationContext ctx) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < params.size(); i++) {
      Parameter p = params.get(i);
      if (i == 0 && dropReceiver && isReceiver(p)) continue;

      String part = typeMapper.mapToCSharp(p.annotation()) + " " + p.name();
      if (p.defaultValue() != null) part += " = " + expr.toCSharp(p.defaultValue(), ctx);
      parts.add(part);
    }
    return String.join(", ", parts);
  }

  /** Annotated return type; without annotation {@code object} if a value is returned, else {@code void}. */
  String returnType(FunctionDef f) {
    if (f.returns() != null) return typeMapper.mapReturnType(f.returns());
    return returnsValue(f.body()) ? "object" : "void";
  }

  private static boolean returnsValue(List<Stmt> body) {
    for (Stmt s : body) {
      if (s instanceof Return r && r.value() != null) return true;
      if (s instanceof If i && (returnsValue(i.body()) || returnsValue(i.orelse()))) return true;
      if (s instanceof While w && (returnsValue(w.body()) || returnsValue(w.orelse()))) return true;
      if (s instanceof For f && (returnsValue(f.body()) || returnsValue(f.orelse()))) return true;
      if (s instanceof ExceptHandler h && returnsValue(h.body())) return true;
      if (s instanceof Try t) {
        if (returnsValue(t.body()) || returnsValue(t.orelse()) || returnsValue(t.finalbody())) return true;
        for (ExceptHandler h : t.handlers()) {
          if (returnsValue(h.body())) return true;
        }
      }
      // nested FunctionDef / ClassDef returns belong to the nested scope
    }
    return false;
  }

  private static boolean isReceiver(Parameter p) {
    return p.name().equals("self") || p.name().equals("cls");
  }

  private static boolean isStaticDecorated(FunctionDef f) {
    return f.decorators().stream().anyMatch(d -> d instanceof NameRef n && STATIC_DECORATORS.contains(n.id()));
  }

  private static boolean hasDecorator(FunctionDef f, String name) {
    return f.decorators().stream().anyMatch(d -> d instanceof NameRef n && n.id().equals(name));
  }
}
