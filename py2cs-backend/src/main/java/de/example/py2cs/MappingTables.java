package de.example.py2cs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static Python -> C# idiom tables: builtin functions, methods, exception kinds and type names.
 *
 * <p>Immutable after construction and safe to share between translations. Every lookup
 * passes the identifier through unchanged on a miss.
 */
public final class MappingTables {

  private static final Map<String, String> DEFAULT_BUILTINS = ordered(
      "print", "Console.WriteLine",
      "len", "Count",
      "str", "Convert.ToString",
      "int", "int.Parse",
      "float", "double.Parse",
      "bool", "bool.Parse",
      "range", "Enumerable.Range",
      "sum", "Sum",
      "max", "Max",
      "min", "Min",
      "sorted", "OrderBy",
      "reversed", "Reverse",
      "enumerate", "Select",
      "zip", "Zip",
      "filter", "Where",
      "map", "Select",
      "any", "Any",
      "all", "All"
  );

  private static final Map<String, String> DEFAULT_METHODS = ordered(
      "append", "Add",
      "extend", "AddRange",
      "insert", "Insert",
      "remove", "Remove",
      "pop", "RemoveAt",
      "clear", "Clear",
      "sort", "Sort",
      "reverse", "Reverse",
      "index", "IndexOf",
      "count", "Count",
      "split", "Split",
      "join", "Join",
      "strip", "Trim",
      "lower", "ToLower",
      "upper", "ToUpper",
      "replace", "Replace",
      "startswith", "StartsWith",
      "endswith", "EndsWith",
      "find", "IndexOf",
      "keys", "Keys",
      "values", "Values",
      "items", "ToList"
  );

  private static final Map<String, String> DEFAULT_EXCEPTIONS = ordered(
      "Exception", "Exception",
      "ValueError", "ArgumentException",
      "TypeError", "InvalidOperationException",
      "KeyError", "KeyNotFoundException",
      "IndexError", "IndexOutOfRangeException",
      "FileNotFoundError", "FileNotFoundException",
      "IOError", "IOException",
      "RuntimeError", "SystemException",
      "NotImplementedError", "NotImplementedException",
      "AttributeError", "MemberAccessException"
  );

  private static final Map<String, String> DEFAULT_TYPES = ordered(
      "int", "int",
      "float", "double",
      "str", "string",
      "bool", "bool",
      "list", "List",
      "dict", "Dictionary",
      "set", "HashSet",
      "tuple", "Tuple",
      "None", "null",
      "True", "true",
      "False", "false"
  );

  private final Map<String, String> builtins;
  private final Map<String, String> methods;
  private final Map<String, String> exceptions;
  private final Map<String, String> types;

  private MappingTables(
      Map<String, String> builtins,
      Map<String, String> methods,
      Map<String, String> exceptions,
      Map<String, String> types
  ) {
    this.builtins = builtins;
    this.methods = methods;
    this.exceptions = exceptions;
    this.types = types;
  }

  public static MappingTables defaults() {
    return new MappingTables(DEFAULT_BUILTINS, DEFAULT_METHODS, DEFAULT_EXCEPTIONS, DEFAULT_TYPES);
  }

  /** Built-in tables with the configured {@code py2cs.*} entries merged on top. */
  public static MappingTables from(TranslatorProperties props) {
    return new MappingTables(
        merge(DEFAULT_BUILTINS, props.getBuiltins()),
        merge(DEFAULT_METHODS, props.getMethods()),
        merge(DEFAULT_EXCEPTIONS, props.getExceptions()),
        merge(DEFAULT_TYPES, props.getTypes())
    );
  }

  public boolean isBuiltin(String name) {
    return builtins.containsKey(name);
  }

  public String builtin(String name) {
    return builtins.getOrDefault(name, name);
  }

  public String method(String name) {
    return methods.getOrDefault(name, name);
  }

  public boolean isException(String name) {
    return exceptions.containsKey(name);
  }

  public String exception(String name) {
    return exceptions.getOrDefault(name, name);
  }

  public String type(String name) {
    return types.getOrDefault(name, name);
  }

  public Map<String, String> builtins() { return builtins; }
  public Map<String, String> methods() { return methods; }
  public Map<String, String> exceptions() { return exceptions; }
  public Map<String, String> types() { return types; }

  private static Map<String, String> merge(Map<String, String> base, Map<String, String> overrides) {
    if (overrides == null || overrides.isEmpty()) return base;
    Map<String, String> m = new LinkedHashMap<>(base);
    m.putAll(overrides);
    return Collections.unmodifiableMap(m);
  }

  private static Map<String, String> ordered(String... kv) {
    Map<String, String> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
    return Collections.unmodifiableMap(m);
  }
}
