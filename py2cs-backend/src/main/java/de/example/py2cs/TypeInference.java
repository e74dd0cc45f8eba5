package de.example.py2cs;

import de.example.py2cs.ast.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

/**
 * Best-effort C# type for a fresh local, guessed from the shape of its initializer.
 * Falls back to {@code var}; never throws.
 */
public final class TypeInference {
  public static final String INFERRED = "var";

  private static final Set<String> TYPE_CONSTRUCTORS = Set.of("int", "float", "str", "bool");

  private final MappingTables tables;

  public TypeInference(MappingTables tables) {
    this.tables = tables;
  }

  public String infer(Expr value) {
    if (value instanceof Constant c) return constantType(c.value());

    if (value instanceof ListLiteral) return "List<object>";
    if (value instanceof DictLiteral) return "Dictionary<object, object>";
    if (value instanceof SetLiteral) return "HashSet<object>";

    if (value instanceof Call call
        && call.func() instanceof NameRef n
        && TYPE_CONSTRUCTORS.contains(n.id())) {
      return tables.type(n.id());
    }

    return INFERRED;
  }

  private static String constantType(Object v) {
    if (v == null) return "object";
    if (v instanceof Boolean) return "bool";
    if (v instanceof String) return "string";
    if (v instanceof Double || v instanceof Float || v instanceof BigDecimal) return "double";
    if (v instanceof Long) return "long";
    if (v instanceof BigInteger b) return b.bitLength() > 63 ? ExpressionTranslator.BIG_INTEGER : "long";
    if (v instanceof Number) return "int";
    return INFERRED;
  }
}
