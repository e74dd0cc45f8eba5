package de.example.py2cs;

import de.example.py2cs.ast.Module;

/** Boundary to whatever produces Python syntax trees. */
public interface SourceParser {

  /**
   * @throws SourceSyntaxException when {@code source} cannot be parsed at all
   * @throws InvalidTreeException when it parses but does not describe a valid tree
   */
  Module parse(String source);
}
