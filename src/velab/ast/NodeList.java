package velab.ast;

import java.util.AbstractList;
import java.util.ArrayList;

/**
 * Ordered list of child nodes. Elements added to the list are adopted by its owner, removed elements are detached.
 */
public class NodeList<T extends Node> extends AbstractList<T> {
  private final Node owner;
  private final ArrayList<T> elems = new ArrayList<>();

  public NodeList(Node owner) { this.owner = owner; }

  public Node getOwner() { return owner; }

  @Override
  public T get(int index) {
    return elems.get(index);
  }

  @Override
  public int size() {
    return elems.size();
  }

  @Override
  public T set(int index, T element) {
    T prev = elems.set(index, element);
    if (prev != element && prev != null)
      prev.setParent(null);
    element.setParent(owner);
    return prev;
  }

  @Override
  public void add(int index, T element) {
    elems.add(index, element);
    element.setParent(owner);
  }

  @Override
  public T remove(int index) {
    T removed = elems.remove(index);
    removed.setParent(null);
    return removed;
  }

  /** Removes trailing elements until only the first n remain. */
  public void purgeTo(int n) {
    while (elems.size() > n)
      remove(elems.size() - 1);
  }

  /** Index of the given node by identity, or -1. */
  public int indexOfNode(Node node) {
    for (int i = 0; i < elems.size(); ++i) {
      if (elems.get(i) == node)
        return i;
    }
    return -1;
  }

  /** Appends clones of all elements of other. */
  @SuppressWarnings("unchecked")
  public void addClonesOf(NodeList<? extends T> other) {
    for (T elem : other)
      add((T)elem.clone());
  }
}
