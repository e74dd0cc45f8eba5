package de.example.py2cs.ast;

import java.util.List;

/**
 * {@code def name(params) -> returns: body}.
 *
 * @param returns return annotation, {@code null} when absent
 * @param decorators decorator expressions in source order
 */
public record FunctionDef(
    String name,
    List<Parameter> params,
    Expr returns,
    List<Stmt> body,
    List<Expr> decorators
) implements Stmt {

  public FunctionDef {
    Nodes.required(name, "FunctionDef", "name");
    params = Nodes.copy(params);
    body = Nodes.copy(body);
    decorators = Nodes.copy(decorators);
  }

  public FunctionDef(String name, List<Parameter> params, Expr returns, List<Stmt> body) {
    this(name, params, returns, body, List.of());
  }
}
