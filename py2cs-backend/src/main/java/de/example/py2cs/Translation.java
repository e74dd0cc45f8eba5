package de.example.py2cs;

import java.util.List;

/**
 * Result of one translation run.
 *
 * @param code the C# text
 * @param unsupported one entry per degradation marker in {@code code}, in emission order
 */
public record Translation(String code, List<String> unsupported) {
  public Translation {
    unsupported = List.copyOf(unsupported);
  }

  public boolean isComplete() {
    return unsupported.isEmpty();
  }
}
