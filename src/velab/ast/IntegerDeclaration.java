package velab.ast;

public class IntegerDeclaration extends Declaration {
  public IntegerDeclaration(Identifier id, Expression value) { super(id, value); }
  public IntegerDeclaration(String name, Expression value) { this(new Identifier(name), value); }
  public IntegerDeclaration(String name) { this(new Identifier(name), null); }

  @Override
  public IntegerDeclaration clone() {
    return new IntegerDeclaration(id, cloneValue());
  }
}
