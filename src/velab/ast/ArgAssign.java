package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A parameter override or port connection: {@code .name(expr)} when named, {@code expr} when ordered.
 * The expression may be missing for an explicitly unconnected port.
 */
public class ArgAssign extends Node {
  private final Identifier exp;
  private final Expression imp;

  public ArgAssign(Identifier exp, Expression imp) {
    this.exp = exp;
    this.imp = adopt(imp);
  }
  public ArgAssign(Expression imp) { this(null, imp); }

  public Optional<Identifier> getExp() { return Optional.ofNullable(exp); }
  public Optional<Expression> getImp() { return Optional.ofNullable(imp); }
  public boolean isNamed() { return exp != null; }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(1);
    if (imp != null)
      ret.add(imp);
    return ret;
  }

  @Override
  public ArgAssign clone() {
    return new ArgAssign(exp, imp == null ? null : imp.clone());
  }
}
