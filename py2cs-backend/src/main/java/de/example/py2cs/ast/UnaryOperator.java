package de.example.py2cs.ast;

import java.util.Arrays;
import java.util.Optional;

public enum UnaryOperator {
  UADD("UAdd"),
  USUB("USub"),
  NOT("Not"),
  INVERT("Invert");

  private final String pythonName;

  UnaryOperator(String pythonName) {
    this.pythonName = pythonName;
  }

  public String pythonName() {
    return pythonName;
  }

  public static Optional<UnaryOperator> fromPythonName(String name) {
    return Arrays.stream(values()).filter(o -> o.pythonName.equals(name)).findFirst();
  }
}
