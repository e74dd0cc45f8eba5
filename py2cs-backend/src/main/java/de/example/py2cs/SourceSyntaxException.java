package de.example.py2cs;

/** The upstream parser could not produce a tree. Aborts the translation. */
public class SourceSyntaxException extends TranslationException {
  private final int line;
  private final int column;

  public SourceSyntaxException(String message, int line, int column, Throwable cause) {
    super(message, cause);
    this.line = line;
    this.column = column;
  }

  public SourceSyntaxException(String message) {
    this(message, -1, -1, null);
  }

  /** 1-based line of the problem, or -1 when unknown. */
  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
