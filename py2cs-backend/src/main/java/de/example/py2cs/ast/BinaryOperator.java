package de.example.py2cs.ast;

import java.util.Arrays;
import java.util.Optional;

public enum BinaryOperator {
  ADD("Add"),
  SUB("Sub"),
  MULT("Mult"),
  DIV("Div"),
  FLOOR_DIV("FloorDiv"),
  MOD("Mod"),
  POW("Pow"),
  LSHIFT("LShift"),
  RSHIFT("RShift"),
  BIT_OR("BitOr"),
  BIT_XOR("BitXor"),
  BIT_AND("BitAnd"),
  MAT_MULT("MatMult");

  private final String pythonName;

  BinaryOperator(String pythonName) {
    this.pythonName = pythonName;
  }

  /** Name of the operator class in Python's {@code ast} module. */
  public String pythonName() {
    return pythonName;
  }

  public static Optional<BinaryOperator> fromPythonName(String name) {
    return Arrays.stream(values()).filter(o -> o.pythonName.equals(name)).findFirst();
  }
}
