package velab.ast;

/** {@code localparam id = value;} */
public class LocalparamDeclaration extends Declaration {
  public LocalparamDeclaration(Identifier id, Expression value) { super(id, value); }
  public LocalparamDeclaration(String name, Expression value) { this(new Identifier(name), value); }
  public LocalparamDeclaration(String name) { this(new Identifier(name), null); }

  @Override
  public LocalparamDeclaration clone() {
    return new LocalparamDeclaration(id, cloneValue());
  }
}
