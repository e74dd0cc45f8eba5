package de.example.py2cs;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.example.py2cs.ast.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Python -> C# best-effort translator, working on an already parsed tree.
 *
 * <p>Stateless apart from the immutable mapping tables: every call builds its own
 * {@link TranslationContext}, so the singleton may serve concurrent requests.
 */
@Service
public class PythonToCSharpTranslator {
  private static final Logger log = LoggerFactory.getLogger(PythonToCSharpTranslator.class);

  private final AstWalker walker;
  private final SourceParser parser;
  private final int indentWidth;

  public PythonToCSharpTranslator() {
    this(new TranslatorProperties(), new JsonTreeReader(new ObjectMapper()));
  }

  @Autowired
  public PythonToCSharpTranslator(TranslatorProperties props, SourceParser parser) {
    this.walker = new AstWalker(MappingTables.from(props), props.getNamespace(), props.getContainerClass());
    this.parser = parser;
    this.indentWidth = props.getIndent();
  }

  // =========================================================
  // Public API
  // =========================================================
  public String translate(Module root) {
    return translateWithReport(root).code();
  }

  public Translation translateWithReport(Module root) {
    if (root == null) throw new InvalidTreeException("Tree root must be a Module, got null");

    TranslationContext ctx = new TranslationContext(new CSharpEmitter(indentWidth));
    walker.visit(root, ctx);

    int depth = ctx.out().depth();
    if (depth != 0) {
      throw new IllegalStateException("Indent level " + depth + " after translation, expected 0");
    }

    Translation t = new Translation(ctx.out().finish(), ctx.unsupported());
    log.info("Translated module: {} top-level statements, {} lines, {} unsupported",
        root.body().size(), ctx.out().lines().size(), t.unsupported().size());
    return t;
  }

  /** Parses {@code source} with the configured {@link SourceParser}, then translates. */
  public Translation translateSource(String source) {
    Module root = parser.parse(source);
    return translateWithReport(root);
  }
}
