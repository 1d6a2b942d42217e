package velab.ui;

/** A design or configuration file that cannot be read or does not have the expected shape. */
public class DesignFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public DesignFormatException(String message) { super(message); }
  public DesignFormatException(String message, Throwable cause) { super(message, cause); }
}
