package de.example.py2cs.ast;

import java.util.Arrays;
import java.util.Optional;

public enum CompareOperator {
  EQ("Eq"),
  NOT_EQ("NotEq"),
  LT("Lt"),
  LT_E("LtE"),
  GT("Gt"),
  GT_E("GtE"),
  IS("Is"),
  IS_NOT("IsNot"),
  IN("In"),
  NOT_IN("NotIn");

  private final String pythonName;

  CompareOperator(String pythonName) {
    this.pythonName = pythonName;
  }

  public String pythonName() {
    return pythonName;
  }

  public static Optional<CompareOperator> fromPythonName(String name) {
    return Arrays.stream(values()).filter(o -> o.pythonName.equals(name)).findFirst();
  }
}
