package velab.ast;

/** Base class of expressions. */
public abstract class Expression extends Node {
  @Override
  public abstract Expression clone();
}
