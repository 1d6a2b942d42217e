package velab.ast;

import java.util.List;

/** A use of a (possibly hierarchical) name inside an expression. */
public class IdentifierRef extends Expression {
  private final Identifier id;

  public IdentifierRef(Identifier id) { this.id = id; }
  public IdentifierRef(String readable) { this(Identifier.parse(readable)); }

  public Identifier getId() { return id; }

  @Override
  public List<Node> children() {
    return List.of();
  }

  @Override
  public IdentifierRef clone() {
    return new IdentifierRef(id);
  }

  @Override
  public String toString() {
    return id.readable();
  }
}
