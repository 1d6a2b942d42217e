package velab.ast;

import java.util.List;

/** {@code assign lhs = rhs;} */
public class ContinuousAssign extends ModuleItem {
  private final IdentifierRef lhs;
  private final Expression rhs;

  public ContinuousAssign(IdentifierRef lhs, Expression rhs) {
    this.lhs = adopt(lhs);
    this.rhs = adopt(rhs);
  }

  public IdentifierRef getLhs() { return lhs; }
  public Expression getRhs() { return rhs; }

  @Override
  public List<Node> children() {
    return List.of(lhs, rhs);
  }

  @Override
  public ContinuousAssign clone() {
    return new ContinuousAssign(lhs.clone(), rhs.clone());
  }
}
