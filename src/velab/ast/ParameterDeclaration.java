package velab.ast;

/** {@code parameter id = value;} The value can be overridden by the instantiating module. */
public class ParameterDeclaration extends Declaration {
  public ParameterDeclaration(Identifier id, Expression value) { super(id, value); }
  public ParameterDeclaration(String name, Expression value) { this(new Identifier(name), value); }
  public ParameterDeclaration(String name) { this(new Identifier(name), null); }

  @Override
  public ParameterDeclaration clone() {
    return new ParameterDeclaration(id, cloneValue());
  }
}
