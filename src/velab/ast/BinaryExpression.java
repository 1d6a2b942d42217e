package velab.ast;

import java.util.List;
import java.util.Optional;

public class BinaryExpression extends Expression {
  /** Binary operators with their symbol and binding strength (higher binds tighter). */
  public enum Op {
    LOGICAL_OR("||", 1),
    LOGICAL_AND("&&", 2),
    BITWISE_OR("|", 3),
    BITWISE_XOR("^", 4),
    BITWISE_AND("&", 5),
    EQ("==", 6),
    NE("!=", 6),
    LT("<", 7),
    LE("<=", 7),
    GT(">", 7),
    GE(">=", 7),
    SHL("<<", 8),
    SHR(">>", 8),
    PLUS("+", 9),
    MINUS("-", 9),
    TIMES("*", 10),
    DIV("/", 10),
    MOD("%", 10);

    private final String symbol;
    private final int precedence;
    Op(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }
    public String getSymbol() { return symbol; }
    public int getPrecedence() { return precedence; }

    public static Optional<Op> fromSymbol(String symbol) {
      for (Op op : values()) {
        if (op.symbol.equals(symbol))
          return Optional.of(op);
      }
      return Optional.empty();
    }
  }

  private final Op op;
  private final Expression lhs;
  private final Expression rhs;

  public BinaryExpression(Expression lhs, Op op, Expression rhs) {
    this.op = op;
    this.lhs = adopt(lhs);
    this.rhs = adopt(rhs);
  }

  public Op getOp() { return op; }
  public Expression getLhs() { return lhs; }
  public Expression getRhs() { return rhs; }

  @Override
  public List<Node> children() {
    return List.of(lhs, rhs);
  }

  @Override
  public BinaryExpression clone() {
    return new BinaryExpression(lhs.clone(), op, rhs.clone());
  }

  @Override
  public String toString() {
    return "(" + lhs + " " + op.getSymbol() + " " + rhs + ")";
  }
}
