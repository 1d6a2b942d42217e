package velab.ast;

/** {@code genvar id;} Genvars have no value of their own; loop generate constructs bind them per iteration. */
public class GenvarDeclaration extends Declaration {
  public GenvarDeclaration(Identifier id) { super(id, null); }
  public GenvarDeclaration(String name) { this(new Identifier(name)); }

  @Override
  public GenvarDeclaration clone() {
    return new GenvarDeclaration(id);
  }
}
