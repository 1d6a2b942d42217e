package velab.analyze;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;
import velab.ast.Declaration;
import velab.ast.GenerateBlock;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.Node;

/**
 * Name resolution and hierarchical naming.
 * Resolutions are cached on the reference; every declaration remembers the references resolved to it,
 * so that {@link #invalidate(Node)} can drop exactly the stale ones.
 */
public class Resolve {
  private static final class Resolution {
    final Declaration target;
    Resolution(Declaration target) { this.target = target; }
  }
  private static final class Dependents {
    final Set<IdentifierRef> refs = Collections.newSetFromMap(new IdentityHashMap<>());
  }

  private final boolean localOnly;

  public Resolve() { this(false); }
  /**
   * @param localOnly if set, hierarchical references are never followed into other scopes
   */
  public Resolve(boolean localOnly) { this.localOnly = localOnly; }

  /**
   * Computes the full hierarchical identifier of a node:
   * the instance names and named generate blocks from the root down to the node.
   */
  public Identifier getFullId(Node node) {
    ArrayDeque<Identifier.Id> path = new ArrayDeque<>();
    if (node instanceof Declaration)
      path.addFirst(((Declaration)node).getId().front());
    for (Node n = node; n != null; n = n.getParent()) {
      if (n instanceof ModuleInstantiation)
        path.addFirst(((ModuleInstantiation)n).getIid().front());
      else if (n instanceof GenerateBlock && ((GenerateBlock)n).isScope())
        path.addFirst(((GenerateBlock)n).getId().get().front());
    }
    if (path.isEmpty() && node instanceof ModuleDeclaration)
      return ((ModuleDeclaration)node).getId();
    if (path.isEmpty())
      throw new IllegalArgumentException("node has no hierarchical name");
    return new Identifier(path.stream().toList());
  }

  /** Resolves a reference to its declaration, if it can be found. */
  public Optional<Declaration> getResolution(IdentifierRef ref) {
    Optional<Resolution> cached = ref.getCache(Resolution.class);
    if (cached.isPresent())
      return Optional.of(cached.get().target);
    Optional<Declaration> ret = lookup(ref);
    if (ret.isPresent()) {
      ref.setCache(Resolution.class, new Resolution(ret.get()));
      dependents(ret.get()).refs.add(ref);
    }
    return ret;
  }

  /** The scope a hierarchical reference continues in after passing through the given node. */
  public static Optional<Node> innerScope(Node node) {
    if (node instanceof ModuleInstantiation)
      return ((ModuleInstantiation)node).getInstance().map(inst -> (Node)inst);
    if (node instanceof GenerateBlock && ((GenerateBlock)node).isScope())
      return Optional.of(node);
    return Optional.empty();
  }

  private Optional<Declaration> lookup(IdentifierRef ref) {
    Identifier id = ref.getId();
    Optional<Node> head = Optional.empty();
    for (Optional<Navigate> nav = Optional.of(new Navigate(ref)); nav.isPresent() && head.isEmpty(); nav = nav.get().up())
      head = nav.get().find(id.front());
    if (head.isEmpty())
      return Optional.empty();

    Node target = head.get();
    for (Identifier.Id seg : id.getIds().subList(1, id.size())) {
      if (localOnly)
        return Optional.empty();
      Optional<Node> scope = innerScope(target);
      if (scope.isEmpty())
        return Optional.empty();
      Optional<Node> next = new Navigate(scope.get()).find(seg);
      if (next.isEmpty())
        return Optional.empty();
      target = next.get();
    }
    return (target instanceof Declaration) ? Optional.of((Declaration)target) : Optional.empty();
  }

  private static Dependents dependents(Declaration decl) {
    Optional<Dependents> ret = decl.getCache(Dependents.class);
    if (ret.isPresent())
      return ret.get();
    Dependents created = new Dependents();
    decl.setCache(Dependents.class, created);
    return created;
  }

  /**
   * Drops every cached resolution that involves the subtree rooted at node:
   * references inside it, and references elsewhere that resolved to declarations inside it.
   */
  public void invalidate(Node node) {
    node.walk(n -> {
      if (n instanceof Declaration) {
        n.getCache(Dependents.class).ifPresent(deps -> deps.refs.forEach(ref -> ref.dropCache(Resolution.class)));
        n.dropCache(Dependents.class);
      } else if (n instanceof IdentifierRef) {
        n.getCache(Resolution.class)
            .flatMap(res -> res.target.getCache(Dependents.class))
            .ifPresent(deps -> deps.refs.remove(n));
        n.dropCache(Resolution.class);
      }
    });
  }
}
