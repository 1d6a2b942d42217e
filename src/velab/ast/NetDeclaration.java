package velab.ast;

/** {@code wire id;} optionally with an initializer. */
public class NetDeclaration extends Declaration {
  public NetDeclaration(Identifier id, Expression value) { super(id, value); }
  public NetDeclaration(String name, Expression value) { this(new Identifier(name), value); }
  public NetDeclaration(String name) { this(new Identifier(name), null); }

  @Override
  public NetDeclaration clone() {
    return new NetDeclaration(id, cloneValue());
  }
}
