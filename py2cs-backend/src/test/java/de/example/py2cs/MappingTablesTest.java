package de.example.py2cs;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MappingTablesTest {

  private final MappingTables tables = MappingTables.defaults();

  @Test
  void builtinsMapToCSharpIdioms() {
    assertEquals("Console.WriteLine", tables.builtin("print"));
    assertEquals("Count", tables.builtin("len"));
    assertEquals("Enumerable.Range", tables.builtin("range"));
    assertTrue(tables.isBuiltin("sorted"));
  }

  @Test
  void unknownNamesPassThrough() {
    assertFalse(tables.isBuiltin("frobnicate"));
    assertEquals("frobnicate", tables.builtin("frobnicate"));
    assertEquals("frobnicate", tables.method("frobnicate"));
    assertEquals("MyError", tables.exception("MyError"));
    assertEquals("Widget", tables.type("Widget"));
  }

  @Test
  void exceptionKindsMapToDotNetExceptions() {
    assertEquals("ArgumentException", tables.exception("ValueError"));
    assertEquals("KeyNotFoundException", tables.exception("KeyError"));
    assertTrue(tables.isException("IndexError"));
  }

  @Test
  void methodAndTypeTables() {
    assertEquals("Add", tables.method("append"));
    assertEquals("ToUpper", tables.method("upper"));
    assertEquals("string", tables.type("str"));
    assertEquals("double", tables.type("float"));
    assertEquals("true", tables.type("True"));
  }

  @Test
  void tablesAreReadOnly() {
    assertThrows(UnsupportedOperationException.class, () -> tables.builtins().put("x", "y"));
  }

  @Test
  void configuredEntriesOverrideAndExtendDefaults() {
    TranslatorProperties props = new TranslatorProperties();
    props.setBuiltins(Map.of("print", "Debug.WriteLine", "input", "Console.ReadLine"));
    props.setExceptions(Map.of("ZeroDivisionError", "DivideByZeroException"));

    MappingTables merged = MappingTables.from(props);

    assertEquals("Debug.WriteLine", merged.builtin("print"));
    assertEquals("Console.ReadLine", merged.builtin("input"));
    assertEquals("DivideByZeroException", merged.exception("ZeroDivisionError"));
    assertEquals("ArgumentException", merged.exception("ValueError"));
    assertEquals("Console.WriteLine", tables.builtin("print"));
  }
}
