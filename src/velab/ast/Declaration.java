package velab.ast;

import java.util.List;
import java.util.Optional;

/** Base class of named declarations. The value is the initializer, if any. */
public abstract class Declaration extends ModuleItem {
  protected final Identifier id;
  protected Expression value;

  protected Declaration(Identifier id, Expression value) {
    if (id.isHierarchical())
      throw new IllegalArgumentException("declared names must not be hierarchical: " + id);
    this.id = id;
    this.value = adopt(value);
  }

  public Identifier getId() { return id; }
  public Optional<Expression> getValue() { return Optional.ofNullable(value); }

  /** Replaces the initializer, detaching the previous one. */
  public void replaceValue(Expression value) {
    if (this.value != null)
      this.value.setParent(null);
    this.value = adopt(value);
  }

  @Override
  public List<Node> children() {
    return value == null ? List.of() : List.of(value);
  }

  @Override
  public abstract Declaration clone();

  protected Expression cloneValue() { return value == null ? null : value.clone(); }
}
