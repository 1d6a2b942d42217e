package velab.ast;

import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Base class of all syntax tree nodes.
 * Every node knows its parent. Analysis passes may attach caches to a node; caches are never copied by {@link #clone()}.
 */
public abstract class Node {
  private Node parent = null;
  private HashMap<Class<?>, Object> caches = null;

  public Node getParent() { return parent; }
  public void setParent(Node parent) { this.parent = parent; }

  /** Makes this node the parent of child (if non-null) and returns child. */
  protected <T extends Node> T adopt(T child) {
    if (child != null)
      child.setParent(this);
    return child;
  }

  /** The syntactic children in source order. Results of elaboration are not included. */
  public abstract List<Node> children();

  /**
   * The children of the elaborated tree.
   * Same as {@link #children()} except that expanded generate constructs contribute the blocks they produced
   * and elaborated instantiations contribute their instance.
   */
  public List<Node> liveChildren() { return children(); }

  /** Pre-order walk over the elaborated tree rooted at this node. */
  public void walk(Consumer<Node> visitor) {
    visitor.accept(this);
    for (Node child : liveChildren())
      child.walk(visitor);
  }

  /** Deep copy of the syntactic subtree. The copy has no parent and no caches. */
  @Override
  public abstract Node clone();

  /** Finds the closest proper ancestor of the given type. */
  public <T extends Node> Optional<T> findAncestor(Class<T> type) {
    for (Node n = parent; n != null; n = n.parent) {
      if (type.isInstance(n))
        return Optional.of(type.cast(n));
    }
    return Optional.empty();
  }

  public <T> Optional<T> getCache(Class<T> key) {
    if (caches == null)
      return Optional.empty();
    return Optional.ofNullable(key.cast(caches.get(key)));
  }

  public <T> void setCache(Class<T> key, T value) {
    if (caches == null)
      caches = new HashMap<>();
    caches.put(key, value);
  }

  public void dropCache(Class<?> key) {
    if (caches != null)
      caches.remove(key);
  }
}
