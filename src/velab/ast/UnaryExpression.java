package velab.ast;

import java.util.List;

public class UnaryExpression extends Expression {
  public enum Op {
    NEGATE("-"),
    LOGICAL_NOT("!"),
    BITWISE_NOT("~");

    private final String symbol;
    Op(String symbol) { this.symbol = symbol; }
    public String getSymbol() { return symbol; }
  }

  private final Op op;
  private final Expression operand;

  public UnaryExpression(Op op, Expression operand) {
    this.op = op;
    this.operand = adopt(operand);
  }

  public Op getOp() { return op; }
  public Expression getOperand() { return operand; }

  @Override
  public List<Node> children() {
    return List.of(operand);
  }

  @Override
  public UnaryExpression clone() {
    return new UnaryExpression(op, operand.clone());
  }

  @Override
  public String toString() {
    return op.getSymbol() + "(" + operand + ")";
  }
}
