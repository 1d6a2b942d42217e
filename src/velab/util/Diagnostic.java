package velab.util;

/**
 * A single reported problem.
 * @param severity error or warning
 * @param kind classification; warnings are always {@link ErrorKind#SemanticError}
 * @param message human-readable description
 */
public record Diagnostic(Severity severity, ErrorKind kind, String message) {
  public enum Severity {
    ERROR,
    WARNING;
  }

  @Override
  public String toString() {
    return severity + " (" + kind + "): " + message;
  }
}
