package de.example.py2cs;

/** The tree is structurally broken (missing root, missing required child, malformed node). */
public class InvalidTreeException extends TranslationException {
  public InvalidTreeException(String message) {
    super(message);
  }

  public InvalidTreeException(String message, Throwable cause) {
    super(message, cause);
  }
}
