package velab.ast;

import java.util.List;
import java.util.Optional;

/** One {@code name = value} entry of an attribute list. The value is optional. */
public class AttrSpec extends Node {
  private final Identifier name;
  private final Expression value;

  public AttrSpec(Identifier name, Expression value) {
    this.name = name;
    this.value = adopt(value);
  }
  public AttrSpec(String name, Expression value) { this(new Identifier(name), value); }
  public AttrSpec(String name) { this(new Identifier(name), null); }

  public Identifier getName() { return name; }
  public Optional<Expression> getValue() { return Optional.ofNullable(value); }

  @Override
  public List<Node> children() {
    return value == null ? List.of() : List.of(value);
  }

  @Override
  public AttrSpec clone() {
    return new AttrSpec(name, value == null ? null : value.clone());
  }
}
