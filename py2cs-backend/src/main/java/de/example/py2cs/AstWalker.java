package de.example.py2cs;

import de.example.py2cs.ast.*;
import de.example.py2cs.ast.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dispatches every statement node to exactly one {@link StatementTranslator} handler.
 *
 * <p>Kinds without a handler, and handlers rejecting a node shape, produce a single
 * {@code // Unsupported statement: Kind} line; the walk then continues with the next sibling.
 */
public final class AstWalker {
  private static final Logger log = LoggerFactory.getLogger(AstWalker.class);

  private final MappingTables tables;
  private final StatementTranslator statements;

  public AstWalker(MappingTables tables, String namespace, String containerClass) {
    this.tables = tables;
    ExpressionTranslator expressions = new ExpressionTranslator(tables);
    TypeMapper typeMapper = new TypeMapper(tables);
    this.statements = new StatementTranslator(
        this,
        expressions,
        typeMapper,
        new TypeInference(tables),
        new SignatureBuilder(typeMapper, expressions),
        namespace,
        containerClass
    );
  }

  public MappingTables tables() {
    return tables;
  }

  public void visitAll(List<Stmt> body, TranslationContext ctx) {
    for (Stmt s : body) {
      visit(s, ctx);
    }
  }

  public void visit(Stmt s, TranslationContext ctx) {
    if (s == null) return;
    try {
      dispatch(s, ctx);
    } catch (UnsupportedConstructException e) {
      unsupported(s.kind(), e.getMessage(), ctx);
    }
  }

  private void dispatch(Stmt s, TranslationContext ctx) {
    if (s instanceof Module m) { statements.emitModule(m, ctx); return; }
    if (s instanceof ClassDef c) { statements.emitClass(c, ctx); return; }
    if (s instanceof FunctionDef f) { statements.emitFunction(f, ctx); return; }
    if (s instanceof Return r) { statements.emitReturn(r, ctx); return; }

    if (s instanceof Assign a) { statements.emitAssign(a, ctx); return; }
    if (s instanceof AnnotatedAssign a) { statements.emitAnnotatedAssign(a, ctx); return; }
    if (s instanceof AugmentedAssign a) { statements.emitAugmentedAssign(a, ctx); return; }

    if (s instanceof If i) { statements.emitIf(i, ctx); return; }
    if (s instanceof While w) { statements.emitWhile(w, ctx); return; }
    if (s instanceof For f) { statements.emitFor(f, ctx); return; }
    if (s instanceof Break) { statements.emitBreak(ctx); return; }
    if (s instanceof Continue) { statements.emitContinue(ctx); return; }
    if (s instanceof Pass) { statements.emitPass(ctx); return; }

    if (s instanceof Try t) { statements.emitTry(t, ctx); return; }
    if (s instanceof ExceptHandler h) { statements.emitExceptHandler(h, ctx); return; }
    if (s instanceof Raise r) { statements.emitRaise(r, ctx); return; }

    if (s instanceof Import i) { statements.emitImport(i, ctx); return; }
    if (s instanceof ImportFrom i) { statements.emitImportFrom(i, ctx); return; }
    if (s instanceof ExpressionStatement e) { statements.emitExpressionStatement(e, ctx); return; }

    // UnsupportedStmt
    unsupported(s.kind(), null, ctx);
  }

  /** Emits the degradation marker line for a statement and records it. */
  void unsupported(String kind, String detail, TranslationContext ctx) {
    String what = detail == null ? kind : kind + " (" + detail + ")";
    log.warn("Unsupported statement: {}", what);
    ctx.reportUnsupported(what);
    ctx.out().line("// Unsupported statement: " + what);
  }
}
