package de.example.py2cs.ast;

import java.util.Arrays;
import java.util.Optional;

public enum BoolOperator {
  AND("And"),
  OR("Or");

  private final String pythonName;

  BoolOperator(String pythonName) {
    this.pythonName = pythonName;
  }

  public String pythonName() {
    return pythonName;
  }

  public static Optional<BoolOperator> fromPythonName(String name) {
    return Arrays.stream(values()).filter(o -> o.pythonName.equals(name)).findFirst();
  }
}
