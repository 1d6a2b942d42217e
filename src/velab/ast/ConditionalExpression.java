package velab.ast;

import java.util.List;

/** {@code cond ? lhs : rhs} */
public class ConditionalExpression extends Expression {
  private final Expression cond;
  private final Expression lhs;
  private final Expression rhs;

  public ConditionalExpression(Expression cond, Expression lhs, Expression rhs) {
    this.cond = adopt(cond);
    this.lhs = adopt(lhs);
    this.rhs = adopt(rhs);
  }

  public Expression getCond() { return cond; }
  public Expression getLhs() { return lhs; }
  public Expression getRhs() { return rhs; }

  @Override
  public List<Node> children() {
    return List.of(cond, lhs, rhs);
  }

  @Override
  public ConditionalExpression clone() {
    return new ConditionalExpression(cond.clone(), lhs.clone(), rhs.clone());
  }

  @Override
  public String toString() {
    return "(" + cond + " ? " + lhs + " : " + rhs + ")";
  }
}
