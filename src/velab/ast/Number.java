package velab.ast;

import java.util.List;

/** Integer literal. */
public class Number extends Expression {
  private final long value;

  public Number(long value) { this.value = value; }

  public long getValue() { return value; }

  @Override
  public List<Node> children() {
    return List.of();
  }

  @Override
  public Number clone() {
    return new Number(value);
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
