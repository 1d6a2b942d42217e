package velab.ast;

import java.util.Optional;

/** Anything that may appear in the body of a module or generate block. */
public abstract class ModuleItem extends Node {
  @Override
  public abstract ModuleItem clone();

  /** The item list this item currently sits in, if it sits in a module or generate block body. */
  public Optional<NodeList<ModuleItem>> getContainingItems() {
    Node parent = getParent();
    if (parent instanceof ModuleDeclaration)
      return Optional.of(((ModuleDeclaration)parent).getItems());
    if (parent instanceof GenerateBlock)
      return Optional.of(((GenerateBlock)parent).getItems());
    return Optional.empty();
  }
}
