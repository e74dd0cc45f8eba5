package de.example.py2cs;

import de.example.py2cs.ast.*;
import de.example.py2cs.ast.Module;
import de.example.py2cs.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One handler per statement kind. Handlers emit lines into the context's emitter and
 * recurse into nested bodies through the {@link AstWalker}.
 *
 * <p>A handler that meets a shape it does not model throws {@link UnsupportedConstructException}
 * before emitting anything; the walker turns that into a marker line.
 */
public final class StatementTranslator {
  private static final Logger log = LoggerFactory.getLogger(StatementTranslator.class);

  static final List<String> PRELUDE = List.of(
      "using System;",
      "using System.Collections.Generic;",
      "using System.Linq;",
      "using System.IO;"
  );

  private final AstWalker walker;
  private final ExpressionTranslator expr;
  private final TypeMapper typeMapper;
  private final TypeInference inference;
  private final SignatureBuilder signatures;
  private final String namespace;
  private final String containerClass;

  public StatementTranslator(
      AstWalker walker,
      ExpressionTranslator expr,
      TypeMapper typeMapper,
      TypeInference inference,
      SignatureBuilder signatures,
      String namespace,
      String containerClass
  ) {
    this.walker = walker;
    this.expr = expr;
    this.typeMapper = typeMapper;
    this.inference = inference;
    this.signatures = signatures;
    this.namespace = namespace;
    this.containerClass = containerClass;
  }

  // =========================================================
  // Declarations
  // =========================================================
  public void emitModule(Module m, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    PRELUDE.forEach(out::line);
    out.blank();

    boolean hasFunctions = m.body().stream().anyMatch(s -> s instanceof FunctionDef);
    boolean hasClasses = m.body().stream().anyMatch(s -> s instanceof ClassDef);

    out.line("namespace " + namespace);
    out.block(() -> {
      if (hasFunctions && !hasClasses) {
        out.line("public class " + containerClass);
        out.block(() -> walker.visitAll(m.body(), ctx));
      } else {
        walker.visitAll(m.body(), ctx);
      }
    });
  }

  public void emitClass(ClassDef c, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    List<String> bases = c.bases().stream()
        .filter(b -> !(b instanceof NameRef n && n.id().equals("object")))
        .map(b -> expr.toCSharp(b, ctx))
        .collect(Collectors.toList());

    out.blank();
    out.line("public class " + c.name() + (bases.isEmpty() ? "" : " : " + String.join(", ", bases)));
    ctx.inClass(c.name(), () -> out.block(() -> walker.visitAll(c.body(), ctx)));
  }

  public void emitFunction(FunctionDef f, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    String header = ctx.inClass() && f.name().equals("__init__")
        ? signatures.buildConstructorLine(ctx.className(), f, ctx)
        : signatures.buildMethodLine(f, ctx);

    out.blank();
    out.line(header);
    out.block(() -> walker.visitAll(f.body(), ctx));
  }

  public void emitReturn(Return r, TranslationContext ctx) {
    if (r.value() == null) {
      ctx.out().line("return;");
      return;
    }
    ctx.out().line("return " + expr.toCSharp(r.value(), ctx) + ";");
  }

  // =========================================================
  // Assignments
  // =========================================================
  public void emitAssign(Assign a, TranslationContext ctx) {
    if (a.targets().size() != 1) {
      throw new UnsupportedConstructException("multiple targets");
    }
    Expr target = a.targets().get(0);

    if (target instanceof NameRef n) {
      String value = expr.toCSharp(a.value(), ctx);
      ctx.out().line(inference.infer(a.value()) + " " + n.id() + " = " + value + ";");
      return;
    }

    if (target instanceof Attribute) {
      ctx.out().line(expr.toCSharp(target, ctx) + " = " + expr.toCSharp(a.value(), ctx) + ";");
      return;
    }

    if (target instanceof Subscript s) {
      if (s.slice() instanceof Slice) throw new UnsupportedConstructException("slice assignment");
      ctx.out().line(expr.toCSharp(s.value(), ctx) + "[" + expr.toCSharp(s.slice(), ctx) + "] = "
          + expr.toCSharp(a.value(), ctx) + ";");
      return;
    }

    throw new UnsupportedConstructException("unpacking into " + target.kind());
  }

  public void emitAnnotatedAssign(AnnotatedAssign a, TranslationContext ctx) {
    if (a.target() instanceof NameRef n) {
      String type = typeMapper.mapToCSharp(a.annotation());
      if (a.value() == null) {
        ctx.out().line(type + " " + n.id() + ";");
      } else {
        ctx.out().line(type + " " + n.id() + " = " + expr.toCSharp(a.value(), ctx) + ";");
      }
      return;
    }

    if (a.target() instanceof Attribute && a.value() != null) {
      ctx.out().line(expr.toCSharp(a.target(), ctx) + " = " + expr.toCSharp(a.value(), ctx) + ";");
      return;
    }

    throw new UnsupportedConstructException("annotated " + a.target().kind() + " target");
  }

  public void emitAugmentedAssign(AugmentedAssign a, TranslationContext ctx) {
    String target = expr.toCSharp(a.target(), ctx);
    String value = expr.toCSharp(a.value(), ctx);

    if (a.op() == BinaryOperator.POW) {
      ctx.out().line(target + " = Math.Pow(" + target + ", " + value + ");");
      return;
    }
    ctx.out().line(target + " " + expr.binarySymbol(a.op()) + "= " + value + ";");
  }

  // =========================================================
  // Control flow
  // =========================================================
  public void emitIf(If s, TranslationContext ctx) {
    emitIfChain(s, "if", ctx);
  }

  // elif chains stay flat: else if (...) instead of else { if (...) }
  private void emitIfChain(If s, String keyword, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    out.line(keyword + " " + condition(s.test(), ctx));
    out.block(() -> walker.visitAll(s.body(), ctx));

    if (s.orelse().isEmpty()) return;

    if (s.orelse().size() == 1 && s.orelse().get(0) instanceof If elif) {
      emitIfChain(elif, "else if", ctx);
      return;
    }

    out.line("else");
    out.block(() -> walker.visitAll(s.orelse(), ctx));
  }

  public void emitWhile(While w, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    out.line("while " + condition(w.test(), ctx));
    out.block(() -> walker.visitAll(w.body(), ctx));
    if (!w.orelse().isEmpty()) walker.unsupported("While", "else clause", ctx);
  }

  public void emitFor(For f, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();

    if (isRangeCall(f.iter())) {
      out.line(countedLoopHeader(f.target(), (Call) f.iter(), ctx));
    } else {
      out.line("foreach (var " + loopVariable(f.target(), ctx) + " in " + expr.toCSharp(f.iter(), ctx) + ")");
    }

    out.block(() -> walker.visitAll(f.body(), ctx));
    if (!f.orelse().isEmpty()) walker.unsupported("For", "else clause", ctx);
  }

  private boolean isRangeCall(Expr iter) {
    return iter instanceof Call c
        && c.func() instanceof NameRef n
        && n.id().equals("range")
        && c.keywords().isEmpty()
        && c.args().size() >= 1 && c.args().size() <= 3;
  }

  /**
   * range(n): 0 .. n, step 1; range(a, b): a .. b, step 1; range(a, b, s): a .. b, step s.
   * A negative literal step counts down.
   */
  private String countedLoopHeader(Expr target, Call range, TranslationContext ctx) {
    String v = target instanceof NameRef n ? n.id() : "i";
    List<Expr> args = range.args();

    String start = args.size() == 1 ? "0" : expr.toCSharp(args.get(0), ctx);
    String end = expr.toCSharp(args.size() == 1 ? args.get(0) : args.get(1), ctx);
    Expr step = args.size() == 3 ? args.get(2) : null;

    String cmp = step != null && ExpressionTranslator.isNegativeNumber(step) ? ">" : "<";
    String update = step == null ? v + "++" : v + " += " + expr.toCSharp(step, ctx);

    return "for (int " + v + " = " + start + "; " + v + " " + cmp + " " + end + "; " + update + ")";
  }

  private String loopVariable(Expr target, TranslationContext ctx) {
    if (target instanceof NameRef n) return n.id();
    if (target instanceof TupleLiteral t && t.elts().stream().allMatch(e -> e instanceof NameRef)) {
      return "(" + t.elts().stream().map(e -> ((NameRef) e).id()).collect(Collectors.joining(", ")) + ")";
    }
    return "item";
  }

  public void emitBreak(TranslationContext ctx) {
    ctx.out().line("break;");
  }

  public void emitContinue(TranslationContext ctx) {
    ctx.out().line("continue;");
  }

  public void emitPass(TranslationContext ctx) {
    ctx.out().line("// pass");
  }

  // =========================================================
  // Exceptions
  // =========================================================
  public void emitTry(Try t, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    out.line("try");
    out.block(() -> walker.visitAll(t.body(), ctx));

    for (ExceptHandler h : t.handlers()) {
      emitExceptHandler(h, ctx);
    }

    if (!t.orelse().isEmpty()) walker.unsupported("Try", "else clause", ctx);

    if (!t.finalbody().isEmpty()) {
      out.line("finally");
      out.block(() -> walker.visitAll(t.finalbody(), ctx));
    }
  }

  public void emitExceptHandler(ExceptHandler h, TranslationContext ctx) {
    CSharpEmitter out = ctx.out();
    out.line(catchHeader(h, ctx));
    out.block(() -> walker.visitAll(h.body(), ctx));
  }

  private String catchHeader(ExceptHandler h, TranslationContext ctx) {
    if (h.type() == null) return "catch (Exception)";

    // except (A, B) as e  =>  catch (Exception e) when (e is A || e is B)
    if (h.type() instanceof TupleLiteral kinds) {
      String bound = h.name() != null ? h.name() : "ex";
      String filter = kinds.elts().stream()
          .map(k -> bound + " is " + exceptionKind(k, ctx))
          .collect(Collectors.joining(" || "));
      return "catch (Exception " + bound + ") when (" + filter + ")";
    }

    String kind = exceptionKind(h.type(), ctx);
    return h.name() == null ? "catch (" + kind + ")" : "catch (" + kind + " " + h.name() + ")";
  }

  private String exceptionKind(Expr type, TranslationContext ctx) {
    return walker.tables().exception(expr.toCSharp(type, ctx));
  }

  public void emitRaise(Raise r, TranslationContext ctx) {
    if (r.cause() != null) {
      log.debug("Raise: dropping 'from' cause {}", r.cause().kind());
    }

    if (r.exc() == null) {
      ctx.out().line("throw;");
      return;
    }

    if (r.exc() instanceof Call c && c.func() instanceof NameRef n) {
      ctx.out().line("throw new " + walker.tables().exception(n.id()) + "(" + expr.arguments(c, ctx) + ");");
      return;
    }

    if (r.exc() instanceof Call c) {
      ctx.out().line("throw new " + expr.toCSharp(c, ctx) + ";");
      return;
    }

    if (r.exc() instanceof NameRef n
        && (walker.tables().isException(n.id()) || Strings.looksLikeTypeName(n.id()))) {
      ctx.out().line("throw new " + walker.tables().exception(n.id()) + "();");
      return;
    }

    ctx.out().line("throw " + expr.toCSharp(r.exc(), ctx) + ";");
  }

  // =========================================================
  // Imports, expression statements
  // =========================================================
  public void emitImport(Import i, TranslationContext ctx) {
    for (Alias a : i.names()) {
      ctx.out().line("// import " + alias(a));
    }
  }

  public void emitImportFrom(ImportFrom i, TranslationContext ctx) {
    String module = ".".repeat(i.level()) + (i.module() == null ? "" : i.module());
    for (Alias a : i.names()) {
      ctx.out().line("// from " + module + " import " + alias(a));
    }
  }

  private static String alias(Alias a) {
    return a.asName() == null ? a.name() : a.name() + " as " + a.asName();
  }

  public void emitExpressionStatement(ExpressionStatement s, TranslationContext ctx) {
    // docstring
    if (s.value() instanceof Constant c && c.isString()) {
      emitCommentLines((String) c.value(), ctx);
      return;
    }
    ctx.out().line(expr.toCSharp(s.value(), ctx) + ";");
  }

  private void emitCommentLines(String text, TranslationContext ctx) {
    String raw = text.replace("\r\n", "\n").replace("\r", "\n").trim();
    if (raw.isEmpty()) {
      ctx.out().line("//");
      return;
    }
    for (String line : raw.split("\n")) {
      String t = line.strip();
      if (!t.isEmpty()) ctx.out().line("// " + t);
    }
  }

  private String condition(Expr test, TranslationContext ctx) {
    return Strings.parenthesized(expr.toCSharp(test, ctx));
  }
}
