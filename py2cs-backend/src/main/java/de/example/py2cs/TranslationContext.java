package de.example.py2cs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run state: output buffer, enclosing class, unsupported constructs met so far.
 * One instance per translation, never shared.
 */
public final class TranslationContext {
  private final CSharpEmitter out;
  private final List<String> unsupported = new ArrayList<>();
  private boolean inClass;
  private String className;

  public TranslationContext(CSharpEmitter out) {
    this.out = out;
  }

  public CSharpEmitter out() {
    return out;
  }

  public boolean inClass() {
    return inClass;
  }

  /** Enclosing class name, {@code null} outside a class body. */
  public String className() {
    return className;
  }

  /** Runs {@code body} inside class {@code name}; the outer scope is restored afterwards. */
  public void inClass(String name, Runnable body) {
    boolean outerInClass = inClass;
    String outerName = className;
    inClass = true;
    className = name;
    try {
      body.run();
    } finally {
      inClass = outerInClass;
      className = outerName;
    }
  }

  public void reportUnsupported(String what) {
    unsupported.add(what);
  }

  public List<String> unsupported() {
    return Collections.unmodifiableList(unsupported);
  }
}
