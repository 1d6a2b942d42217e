package velab.analyze;

/** Thrown when an expression that must be constant cannot be evaluated. */
@SuppressWarnings("serial")
public class EvaluationException extends RuntimeException {
  public EvaluationException(String message) { super(message); }
}
