package velab.ast;

/** ANSI style port in a module header. */
public class PortDeclaration extends Declaration {
  public enum Direction {
    INPUT,
    OUTPUT,
    INOUT;
  }

  private final Direction direction;
  private final boolean reg;

  public PortDeclaration(Direction direction, Identifier id, boolean reg) {
    super(id, null);
    this.direction = direction;
    this.reg = reg;
  }
  public PortDeclaration(Direction direction, String name) { this(direction, new Identifier(name), false); }

  public Direction getDirection() { return direction; }
  public boolean isReg() { return reg; }

  @Override
  public PortDeclaration clone() {
    return new PortDeclaration(direction, id, reg);
  }
}
