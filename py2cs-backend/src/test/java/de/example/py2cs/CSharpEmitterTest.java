package de.example.py2cs;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CSharpEmitterTest {

  @Test
  void blockIndentsBodyAndClosesBrace() {
    CSharpEmitter out = new CSharpEmitter();
    out.line("class A");
    out.block(() -> out.line("int x;"));

    assertEquals(List.of("class A", "{", "    int x;", "}"), out.lines());
    assertEquals(0, out.depth());
  }

  @Test
  void indentWidthIsConfigurable() {
    CSharpEmitter out = new CSharpEmitter(2);
    out.block(() -> out.block(() -> out.line("x;")));
    assertEquals("{\n  {\n    x;\n  }\n}", out.finish());
  }

  @Test
  void blockRestoresIndentWhenBodyThrows() {
    CSharpEmitter out = new CSharpEmitter();
    assertThrows(IllegalStateException.class, () -> out.block(() -> {
      out.line("a;");
      throw new IllegalStateException("boom");
    }));

    assertEquals(0, out.depth());
    assertEquals("}", out.lines().get(out.lines().size() - 1));
  }

  @Test
  void blankLinesCarryNoIndent() {
    CSharpEmitter out = new CSharpEmitter();
    out.block(out::blank);
    assertEquals("", out.lines().get(1));
  }

  @Test
  void classScopeIsRestoredForNestedClasses() {
    TranslationContext ctx = new TranslationContext(new CSharpEmitter());
    assertFalse(ctx.inClass());

    ctx.inClass("Outer", () -> {
      ctx.inClass("Inner", () -> assertEquals("Inner", ctx.className()));
      assertEquals("Outer", ctx.className());
    });

    assertFalse(ctx.inClass());
    assertNull(ctx.className());
  }
}
