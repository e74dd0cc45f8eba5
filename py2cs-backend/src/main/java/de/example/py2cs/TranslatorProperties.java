package de.example.py2cs;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Settings under {@code py2cs.*}. */
@ConfigurationProperties(prefix = "py2cs")
public class TranslatorProperties {

  /** Namespace wrapping every translated module. */
  private String namespace = "PythonTranslated";

  /** Class synthesized to host module-level functions when a module declares no class. */
  private String containerClass = "Program";

  /** Spaces per indent level. */
  private int indent = 4;

  /** Request bodies above this size are rejected by the REST layer. */
  private int maxInputChars = 200_000;

  /** Browser origins allowed to call {@code /api/**}. */
  private List<String> corsOrigins = new ArrayList<>(List.of("http://localhost:5173", "http://127.0.0.1:5173"));

  // Entries merged over the built-in mapping tables.
  private Map<String, String> builtins = new LinkedHashMap<>();
  private Map<String, String> methods = new LinkedHashMap<>();
  private Map<String, String> exceptions = new LinkedHashMap<>();
  private Map<String, String> types = new LinkedHashMap<>();

  public String getNamespace() { return namespace; }
  public void setNamespace(String namespace) { this.namespace = namespace; }

  public String getContainerClass() { return containerClass; }
  public void setContainerClass(String containerClass) { this.containerClass = containerClass; }

  public int getIndent() { return indent; }
  public void setIndent(int indent) { this.indent = indent; }

  public int getMaxInputChars() { return maxInputChars; }
  public void setMaxInputChars(int maxInputChars) { this.maxInputChars = maxInputChars; }

  public List<String> getCorsOrigins() { return corsOrigins; }
  public void setCorsOrigins(List<String> corsOrigins) { this.corsOrigins = corsOrigins; }

  public Map<String, String> getBuiltins() { return builtins; }
  public void setBuiltins(Map<String, String> builtins) { this.builtins = builtins; }

  public Map<String, String> getMethods() { return methods; }
  public void setMethods(Map<String, String> methods) { this.methods = methods; }

  public Map<String, String> getExceptions() { return exceptions; }
  public void setExceptions(Map<String, String> exceptions) { this.exceptions = exceptions; }

  public Map<String, String> getTypes() { return types; }
  public void setTypes(Map<String, String> types) { this.types = types; }
}
