package de.example.py2cs;

/** Base of all failures raised while turning a Python tree into C#. */
public class TranslationException extends RuntimeException {
  public TranslationException(String message) {
    super(message);
  }

  public TranslationException(String message, Throwable cause) {
    super(message, cause);
  }
}
