package velab.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import velab.util.Diagnostic.Severity;

/**
 * Diagnostics sink. Operations report failure by recording an error here rather than by throwing;
 * callers inspect {@link #error()} after each call.
 */
public class Loggable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ArrayList<Diagnostic> errors = new ArrayList<>();
  private final ArrayList<Diagnostic> warnings = new ArrayList<>();

  public void clearLogs() {
    errors.clear();
    warnings.clear();
  }

  /** Appends all diagnostics of other to this sink. */
  public void copyLogs(Loggable other) {
    errors.addAll(other.errors);
    warnings.addAll(other.warnings);
  }

  public boolean error() { return !errors.isEmpty(); }
  public boolean warning() { return !warnings.isEmpty(); }

  public List<Diagnostic> getErrors() { return Collections.unmodifiableList(errors); }
  public List<Diagnostic> getWarnings() { return Collections.unmodifiableList(warnings); }

  /** Whether an error of the given kind has been recorded. */
  public boolean error(ErrorKind kind) {
    return errors.stream().anyMatch(diag -> diag.kind() == kind);
  }

  public void error(ErrorKind kind, String message) {
    logger.debug("{}: {}", kind, message);
    errors.add(new Diagnostic(Severity.ERROR, kind, message));
  }

  public void error(String message) { error(ErrorKind.SemanticError, message); }

  public void warn(String message) {
    logger.debug("warning: {}", message);
    warnings.add(new Diagnostic(Severity.WARNING, ErrorKind.SemanticError, message));
  }
}
