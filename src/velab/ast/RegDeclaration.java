package velab.ast;

public class RegDeclaration extends Declaration {
  public RegDeclaration(Identifier id, Expression value) { super(id, value); }
  public RegDeclaration(String name, Expression value) { this(new Identifier(name), value); }
  public RegDeclaration(String name) { this(new Identifier(name), null); }

  @Override
  public RegDeclaration clone() {
    return new RegDeclaration(id, cloneValue());
  }
}
