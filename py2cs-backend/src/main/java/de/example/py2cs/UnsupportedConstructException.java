package de.example.py2cs;

/**
 * A node shape the translator does not model. Never escapes a translation run:
 * the walker catches it at the offending statement and emits a marker instead.
 */
public class UnsupportedConstructException extends TranslationException {
  public UnsupportedConstructException(String message) {
    super(message);
  }
}
