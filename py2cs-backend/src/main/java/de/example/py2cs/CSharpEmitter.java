package de.example.py2cs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Append-only line buffer with an indent level. */
public final class CSharpEmitter {
  private final List<String> lines = new ArrayList<>();
  private final String indentUnit;
  private int indent = 0;

  public CSharpEmitter() {
    this(4);
  }

  public CSharpEmitter(int indentWidth) {
    this.indentUnit = " ".repeat(Math.max(0, indentWidth));
  }

  public void indent(Runnable r) {
    indent++;
    try { r.run(); }
    finally { indent--; }
  }

  /** {@code {}, indented body, {@code }}. Indent and closing brace survive an exception in {@code body}. */
  public void block(Runnable body) {
    line("{");
    try { indent(body); }
    finally { line("}"); }
  }

  public void line(String s) {
    if (s == null || s.isEmpty()) {
      lines.add("");
      return;
    }
    lines.add(indentUnit.repeat(Math.max(0, indent)) + s);
  }

  public void blank() {
    lines.add("");
  }

  /** Current indent level; 0 outside every block. */
  public int depth() {
    return indent;
  }

  public List<String> lines() {
    return Collections.unmodifiableList(lines);
  }

  public String finish() {
    return String.join("\n", lines);
  }

  @Override
  public String toString() {
    return finish();
  }
}
