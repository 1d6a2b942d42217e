package velab.ast;

import java.util.List;

public class StringLiteral extends Expression {
  private final String value;

  public StringLiteral(String value) { this.value = value; }

  public String getValue() { return value; }

  @Override
  public List<Node> children() {
    return List.of();
  }

  @Override
  public StringLiteral clone() {
    return new StringLiteral(value);
  }

  @Override
  public String toString() {
    return "\"" + value + "\"";
  }
}
