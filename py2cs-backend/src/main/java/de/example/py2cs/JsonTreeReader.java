package de.example.py2cs;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import de.example.py2cs.ast.*;
import de.example.py2cs.ast.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads the JSON form of a Python {@code ast} tree.
 *
 * <p>Every node object carries its kind in {@code "_type"}, or in {@code "kind"} when
 * {@code "_type"} is absent; field names are the ones of Python's {@code ast} module ({@code body}, {@code orelse}, {@code decorator_list}, ...).
 * Python class names ({@code BinOp}, {@code AnnAssign}, {@code JoinedStr}, ...) are accepted
 * next to this package's record names. Kinds outside the model become
 * {@link UnsupportedStmt} / {@link UnsupportedExpr} so the walker can mark them.
 */
@Component
public class JsonTreeReader implements SourceParser {
  private static final Logger log = LoggerFactory.getLogger(JsonTreeReader.class);

  private static final Map<String, String> STMT_ALIASES = Map.of(
      "AnnAssign", "AnnotatedAssign",
      "AugAssign", "AugmentedAssign",
      "Expr", "ExpressionStatement"
  );

  private static final Map<String, String> EXPR_ALIASES = Map.ofEntries(
      Map.entry("Name", "NameRef"),
      Map.entry("BinOp", "BinaryOp"),
      Map.entry("List", "ListLiteral"),
      Map.entry("Dict", "DictLiteral"),
      Map.entry("Set", "SetLiteral"),
      Map.entry("Tuple", "TupleLiteral"),
      Map.entry("ListComp", "ListComprehension"),
      Map.entry("DictComp", "DictComprehension"),
      Map.entry("SetComp", "SetComprehension"),
      Map.entry("JoinedStr", "InterpolatedString"),
      Map.entry("FormattedValue", "InterpolationSlot"),
      Map.entry("Num", "Constant"),
      Map.entry("Str", "Constant"),
      Map.entry("NameConstant", "Constant")
  );

  private final ObjectMapper mapper;

  public JsonTreeReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public Module parse(String source) {
    JsonNode root;
    try {
      root = mapper.readTree(source);
    } catch (JsonProcessingException e) {
      JsonLocation loc = e.getLocation();
      int line = loc == null ? -1 : loc.getLineNr();
      int column = loc == null ? -1 : loc.getColumnNr();
      throw new SourceSyntaxException("Malformed tree document: " + e.getOriginalMessage(), line, column, e);
    }
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new SourceSyntaxException("Empty tree document");
    }

    Stmt s = stmt(root, "$");
    if (!(s instanceof Module m)) {
      throw new InvalidTreeException("$: root must be a Module, got " + s.kind());
    }
    log.debug("Read tree with {} top-level statements", m.body().size());
    return m;
  }

  // =========================================================
  // Statements
  // =========================================================
  private Stmt stmt(JsonNode n, String path) {
    String kind = kindOf(n, path);
    kind = STMT_ALIASES.getOrDefault(kind, kind);
    try {
      return buildStmt(kind, n, path);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new InvalidTreeException(path + ": " + e.getMessage(), e);
    }
  }

  private Stmt buildStmt(String kind, JsonNode n, String path) {
    switch (kind) {
      case "Module":
        return new Module(stmts(n, "body", path));
      case "ClassDef":
        return new ClassDef(text(n, "name", path), exprs(n, "bases", path), stmts(n, "body", path));
      case "FunctionDef":
        return new FunctionDef(
            text(n, "name", path),
            parameters(n.get("args"), path + ".args"),
            optExpr(n, "returns", path),
            stmts(n, "body", path),
            exprs(n, "decorator_list", path));
      case "Return":
        return new Return(optExpr(n, "value", path));
      case "Assign":
        return new Assign(exprs(n, "targets", path), expr(n, "value", path));
      case "AnnotatedAssign":
        return new AnnotatedAssign(expr(n, "target", path), expr(n, "annotation", path), optExpr(n, "value", path));
      case "AugmentedAssign":
        return new AugmentedAssign(
            expr(n, "target", path),
            operator(n, "op", path, BinaryOperator::fromPythonName),
            expr(n, "value", path));
      case "If":
        return new If(expr(n, "test", path), stmts(n, "body", path), stmts(n, "orelse", path));
      case "While":
        return new While(expr(n, "test", path), stmts(n, "body", path), stmts(n, "orelse", path));
      case "For":
        return new For(expr(n, "target", path), expr(n, "iter", path), stmts(n, "body", path), stmts(n, "orelse", path));
      case "Break":
        return new Break();
      case "Continue":
        return new Continue();
      case "Pass":
        return new Pass();
      case "Try":
        return new Try(stmts(n, "body", path), handlers(n, path), stmts(n, "orelse", path), stmts(n, "finalbody", path));
      case "ExceptHandler":
        return handler(n, path);
      case "Raise":
        return new Raise(optExpr(n, "exc", path), optExpr(n, "cause", path));
      case "Import":
        return new Import(aliases(n, path));
      case "ImportFrom":
        return new ImportFrom(optText(n, "module"), aliases(n, path), n.path("level").asInt(0));
      case "ExpressionStatement":
        return new ExpressionStatement(expr(n, "value", path));
      default:
        log.debug("{}: no statement model for kind {}", path, kind);
        return new UnsupportedStmt(kind);
    }
  }

  private ExceptHandler handler(JsonNode n, String path) {
    return new ExceptHandler(optExpr(n, "type", path), optText(n, "name"), stmts(n, "body", path));
  }

  private List<ExceptHandler> handlers(JsonNode n, String path) {
    List<ExceptHandler> out = new ArrayList<>();
    JsonNode arr = array(n, "handlers", path);
    for (int i = 0; i < arr.size(); i++) {
      String p = path + ".handlers[" + i + "]";
      Stmt s = stmt(arr.get(i), p);
      if (!(s instanceof ExceptHandler h)) {
        throw new InvalidTreeException(p + ": expected ExceptHandler, got " + s.kind());
      }
      out.add(h);
    }
    return out;
  }

  /** Python's {@code arguments} node; defaults align with the tail of the positional list. */
  private List<Parameter> parameters(JsonNode args, String path) {
    if (args == null || args.isNull()) return List.of();
    if (!args.isObject()) throw new InvalidTreeException(path + ": expected an arguments object");

    List<JsonNode> positional = new ArrayList<>();
    array(args, "posonlyargs", path).forEach(positional::add);
    array(args, "args", path).forEach(positional::add);
    JsonNode defaults = array(args, "defaults", path);
    int firstDefault = positional.size() - defaults.size();

    List<Parameter> out = new ArrayList<>();
    for (int i = 0; i < positional.size(); i++) {
      Expr def = i >= firstDefault ? exprOrNull(defaults.get(i - firstDefault), path + ".defaults[" + (i - firstDefault) + "]") : null;
      out.add(parameter(positional.get(i), def, path + ".args[" + i + "]"));
    }

    JsonNode kwonly = array(args, "kwonlyargs", path);
    JsonNode kwDefaults = array(args, "kw_defaults", path);
    for (int i = 0; i < kwonly.size(); i++) {
      Expr def = i < kwDefaults.size() ? exprOrNull(kwDefaults.get(i), path + ".kw_defaults[" + i + "]") : null;
      out.add(parameter(kwonly.get(i), def, path + ".kwonlyargs[" + i + "]"));
    }

    if (hasValue(args, "vararg") || hasValue(args, "kwarg")) {
      log.debug("{}: *args/**kwargs parameters dropped", path);
    }
    return out;
  }

  private Parameter parameter(JsonNode arg, Expr defaultValue, String path) {
    return new Parameter(text(arg, "arg", path), optExpr(arg, "annotation", path), defaultValue);
  }

  private List<Alias> aliases(JsonNode n, String path) {
    List<Alias> out = new ArrayList<>();
    JsonNode arr = array(n, "names", path);
    for (int i = 0; i < arr.size(); i++) {
      JsonNode a = arr.get(i);
      out.add(new Alias(text(a, "name", path + ".names[" + i + "]"), optText(a, "asname")));
    }
    return out;
  }

  // =========================================================
  // Expressions
  // =========================================================
  private Expr exprNode(JsonNode n, String path) {
    String kind = kindOf(n, path);
    kind = EXPR_ALIASES.getOrDefault(kind, kind);
    try {
      return buildExpr(kind, n, path);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new InvalidTreeException(path + ": " + e.getMessage(), e);
    }
  }

  private Expr buildExpr(String kind, JsonNode n, String path) {
    switch (kind) {
      case "Constant":
        return constant(n, path);
      case "NameRef":
        return new NameRef(text(n, "id", path));
      case "BinaryOp":
        return new BinaryOp(
            expr(n, "left", path),
            operator(n, "op", path, BinaryOperator::fromPythonName),
            expr(n, "right", path));
      case "UnaryOp":
        return new UnaryOp(operator(n, "op", path, UnaryOperator::fromPythonName), expr(n, "operand", path));
      case "Compare":
        return new Compare(expr(n, "left", path), compareOps(n, path), exprs(n, "comparators", path));
      case "BoolOp":
        return new BoolOp(operator(n, "op", path, BoolOperator::fromPythonName), exprs(n, "values", path));
      case "Call":
        return new Call(expr(n, "func", path), exprs(n, "args", path), keywords(n, path));
      case "Attribute":
        return new Attribute(expr(n, "value", path), text(n, "attr", path));
      case "Subscript":
        return new Subscript(expr(n, "value", path), subscriptIndex(n, path));
      case "Slice":
        return new Slice(optExpr(n, "lower", path), optExpr(n, "upper", path), optExpr(n, "step", path));
      case "ListLiteral":
        return new ListLiteral(exprs(n, "elts", path));
      case "SetLiteral":
        return new SetLiteral(exprs(n, "elts", path));
      case "TupleLiteral":
        return new TupleLiteral(exprs(n, "elts", path));
      case "DictLiteral":
        return new DictLiteral(nullableExprs(n, "keys", path), exprs(n, "values", path));
      case "ListComprehension":
        return new ListComprehension(expr(n, "elt", path), generators(n, path));
      case "SetComprehension":
        return new SetComprehension(expr(n, "elt", path), generators(n, path));
      case "DictComprehension":
        return new DictComprehension(expr(n, "key", path), expr(n, "value", path), generators(n, path));
      case "InterpolatedString":
        return new InterpolatedString(exprs(n, "values", path));
      case "InterpolationSlot":
        return new InterpolationSlot(expr(n, "value", path), n.path("conversion").asInt(-1), optExpr(n, "format_spec", path));
      default:
        log.debug("{}: no expression model for kind {}", path, kind);
        return new UnsupportedExpr(kind);
    }
  }

  /** Accepts {@code value} (Constant, NameConstant), {@code n} (Num) and {@code s} (Str). */
  private Constant constant(JsonNode n, String path) {
    JsonNode v = n.has("value") ? n.get("value") : n.has("n") ? n.get("n") : n.get("s");
    if (v == null || v.isNull()) return Constant.none();
    if (v.isTextual()) return new Constant(v.textValue());
    if (v.isBoolean()) return new Constant(v.booleanValue());
    if (v.isNumber()) return new Constant(v.numberValue());
    throw new InvalidTreeException(path + ".value: unsupported constant of JSON type " + v.getNodeType());
  }

  /** Pre-3.9 trees wrap the index in {@code Index}; unwrap it. */
  private Expr subscriptIndex(JsonNode n, String path) {
    JsonNode slice = required(n, "slice", path);
    if (slice.isObject() && "Index".equals(slice.path("_type").asText(slice.path("kind").asText()))) {
      return expr(slice, "value", path + ".slice");
    }
    return exprNode(slice, path + ".slice");
  }

  private List<CompareOperator> compareOps(JsonNode n, String path) {
    List<CompareOperator> out = new ArrayList<>();
    JsonNode arr = array(n, "ops", path);
    for (int i = 0; i < arr.size(); i++) {
      out.add(resolveOperator(arr.get(i), path + ".ops[" + i + "]", CompareOperator::fromPythonName));
    }
    return out;
  }

  private List<Keyword> keywords(JsonNode n, String path) {
    List<Keyword> out = new ArrayList<>();
    JsonNode arr = array(n, "keywords", path);
    for (int i = 0; i < arr.size(); i++) {
      String p = path + ".keywords[" + i + "]";
      out.add(new Keyword(optText(arr.get(i), "arg"), expr(arr.get(i), "value", p)));
    }
    return out;
  }

  private List<Comprehension> generators(JsonNode n, String path) {
    List<Comprehension> out = new ArrayList<>();
    JsonNode arr = array(n, "generators", path);
    for (int i = 0; i < arr.size(); i++) {
      String p = path + ".generators[" + i + "]";
      JsonNode g = arr.get(i);
      if (g.path("is_async").asInt(0) != 0) {
        log.debug("{}: async comprehension read as a plain one", p);
      }
      out.add(new Comprehension(expr(g, "target", p), expr(g, "iter", p), exprs(g, "ifs", p)));
    }
    return out;
  }

  // =========================================================
  // JSON helpers
  // =========================================================
  private static String kindOf(JsonNode n, String path) {
    if (n == null || !n.isObject()) {
      throw new InvalidTreeException(path + ": expected a node object");
    }
    // "_type" wins: Python's Constant has its own "kind" field (null or "u")
    JsonNode k = n.get("_type");
    if (k == null || k.isNull()) k = n.get("kind");
    if (k == null || !k.isTextual() || k.textValue().isBlank()) {
      throw new InvalidTreeException(path + ": node has no \"kind\" or \"_type\"");
    }
    return k.textValue();
  }

  private <E> E operator(JsonNode n, String field, String path, Function<String, Optional<E>> resolver) {
    return resolveOperator(required(n, field, path), path + "." + field, resolver);
  }

  /** Operators arrive as {@code "Add"} or as a node object {@code {"_type": "Add"}}. */
  private static <E> E resolveOperator(JsonNode op, String path, Function<String, Optional<E>> resolver) {
    String name = op.isTextual() ? op.textValue() : kindOf(op, path);
    return resolver.apply(name)
        .orElseThrow(() -> new InvalidTreeException(path + ": unknown operator " + name));
  }

  private Expr expr(JsonNode n, String field, String path) {
    return exprNode(required(n, field, path), path + "." + field);
  }

  private Expr optExpr(JsonNode n, String field, String path) {
    return exprOrNull(n.get(field), path + "." + field);
  }

  private Expr exprOrNull(JsonNode n, String path) {
    return n == null || n.isNull() ? null : exprNode(n, path);
  }

  private List<Expr> exprs(JsonNode n, String field, String path) {
    List<Expr> out = new ArrayList<>();
    JsonNode arr = array(n, field, path);
    for (int i = 0; i < arr.size(); i++) {
      out.add(exprNode(arr.get(i), path + "." + field + "[" + i + "]"));
    }
    return out;
  }

  private List<Expr> nullableExprs(JsonNode n, String field, String path) {
    List<Expr> out = new ArrayList<>();
    JsonNode arr = array(n, field, path);
    for (int i = 0; i < arr.size(); i++) {
      out.add(exprOrNull(arr.get(i), path + "." + field + "[" + i + "]"));
    }
    return out;
  }

  private List<Stmt> stmts(JsonNode n, String field, String path) {
    List<Stmt> out = new ArrayList<>();
    JsonNode arr = array(n, field, path);
    for (int i = 0; i < arr.size(); i++) {
      out.add(stmt(arr.get(i), path + "." + field + "[" + i + "]"));
    }
    return out;
  }

  /** Missing or null lists read as empty. */
  private static JsonNode array(JsonNode n, String field, String path) {
    JsonNode arr = n.get(field);
    if (arr == null || arr.isNull()) return JsonNodeFactory.instance.arrayNode();
    if (!arr.isArray()) throw new InvalidTreeException(path + "." + field + ": expected a list");
    return arr;
  }

  private static JsonNode required(JsonNode n, String field, String path) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) {
      throw new InvalidTreeException(path + "." + field + " is required");
    }
    return v;
  }

  private static String text(JsonNode n, String field, String path) {
    JsonNode v = required(n, field, path);
    if (!v.isTextual()) throw new InvalidTreeException(path + "." + field + ": expected a string");
    return v.textValue();
  }

  private static String optText(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v == null || v.isNull() ? null : v.asText();
  }

  private static boolean hasValue(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v != null && !v.isNull();
  }
}
