package velab.analyze;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import velab.ast.Declaration;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.Identifier;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.Node;

/**
 * Scope navigation. A Navigate is positioned at the scope that encloses a node (or the node itself if it is a scope).
 * Modules and generate blocks are scopes. Unnamed generate blocks that resulted from expansion are transparent:
 * their names are also visible in the enclosing scope.
 * The name table of a scope is built lazily and cached on the scope node until {@link #invalidate()}.
 */
public class Navigate {
  private static final class ScopeCache {
    final LinkedHashMap<Identifier.Id, List<Node>> names = new LinkedHashMap<>();
  }

  private final Node scope;

  public Navigate(Node node) { this.scope = findScope(node); }

  private static boolean isScope(Node node) { return node instanceof ModuleDeclaration || node instanceof GenerateBlock; }

  private static Node findScope(Node node) {
    for (Node n = node; n != null; n = n.getParent()) {
      if (isScope(n))
        return n;
    }
    return null;
  }

  /** True if the node is not located in any scope (e.g. the root instantiation). */
  public boolean lost() { return scope == null; }

  public Optional<Node> getScope() { return Optional.ofNullable(scope); }

  /**
   * The scope enclosing the current one, within the same module.
   * Module scopes have no enclosing scope: name lookup never crosses a module boundary upwards.
   */
  public Optional<Navigate> up() {
    if (scope == null || scope instanceof ModuleDeclaration || scope.getParent() == null)
      return Optional.empty();
    Navigate ret = new Navigate(scope.getParent());
    return ret.lost() ? Optional.empty() : Optional.of(ret);
  }

  /** Looks up a name declared directly in this scope. */
  public Optional<Node> find(Identifier.Id id) {
    if (scope == null)
      return Optional.empty();
    List<Node> found = names().names.get(id);
    return (found == null) ? Optional.empty() : Optional.of(found.get(0));
  }

  /** Number of nodes that declare the given name in this scope. More than one is a conflict. */
  public int count(Identifier.Id id) {
    if (scope == null)
      return 0;
    List<Node> found = names().names.get(id);
    return (found == null) ? 0 : found.size();
  }

  public Set<Identifier.Id> getNames() {
    if (scope == null)
      return Set.of();
    return names().names.keySet();
  }

  /** Drops the cached name table of this scope. */
  public void invalidate() {
    if (scope != null)
      scope.dropCache(ScopeCache.class);
  }

  private ScopeCache names() {
    Optional<ScopeCache> cached = scope.getCache(ScopeCache.class);
    if (cached.isPresent())
      return cached.get();
    ScopeCache ret = new ScopeCache();
    if (scope instanceof ModuleDeclaration) {
      ModuleDeclaration md = (ModuleDeclaration)scope;
      collect(md.getPorts(), ret);
      collect(md.getItems(), ret);
    } else {
      collect(((GenerateBlock)scope).getItems(), ret);
    }
    scope.setCache(ScopeCache.class, ret);
    return ret;
  }

  private static void collect(List<? extends Node> items, ScopeCache cache) {
    for (Node item : items) {
      if (item instanceof Declaration) {
        put(cache, ((Declaration)item).getId().front(), item);
      } else if (item instanceof ModuleInstantiation) {
        put(cache, ((ModuleInstantiation)item).getIid().front(), item);
      } else if (item instanceof GenerateBlock) {
        collectBlock((GenerateBlock)item, cache);
      } else if (item instanceof GenerateConstruct) {
        for (GenerateBlock block : ((GenerateConstruct)item).getGenerated())
          collectBlock(block, cache);
      }
    }
  }

  private static void collectBlock(GenerateBlock block, ScopeCache cache) {
    if (block.isScope())
      put(cache, block.getId().get().front(), block);
    else
      collect(block.getItems(), cache);
  }

  private static void put(ScopeCache cache, Identifier.Id id, Node node) {
    cache.names.computeIfAbsent(id, id_ -> new ArrayList<>(1)).add(node);
  }
}
