package de.example.py2cs.ast;

import java.util.List;
import java.util.Objects;

final class Nodes {
  private Nodes() {}

  static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  static <T> T required(T value, String kind, String field) {
    return Objects.requireNonNull(value, () -> kind + "." + field + " must not be null");
  }
}
