package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Body of a generate construct, or the block an inlined instance was turned into.
 * A named block contributes a segment to hierarchical names; an unnamed one is transparent.
 */
public class GenerateBlock extends ModuleItem {
  private final Identifier id;
  private final NodeList<ModuleItem> items = new NodeList<>(this);

  // Set only while this block stands in for an inlined instance.
  private ModuleInstantiation inlinedFrom = null;

  public GenerateBlock(Identifier id, List<ModuleItem> items) {
    if (id != null && id.isHierarchical())
      throw new IllegalArgumentException("block names must not be hierarchical: " + id);
    this.id = id;
    this.items.addAll(items);
  }
  public GenerateBlock(List<ModuleItem> items) { this(null, items); }

  public Optional<Identifier> getId() { return Optional.ofNullable(id); }
  public boolean isScope() { return id != null; }
  public NodeList<ModuleItem> getItems() { return items; }

  /** Returns a copy of this block's items under another name. */
  public GenerateBlock cloneAs(Identifier newId) {
    GenerateBlock ret = new GenerateBlock(newId, List.of());
    ret.items.addClonesOf(items);
    return ret;
  }

  /** The instantiation this block replaced when its instance was inlined. */
  public Optional<ModuleInstantiation> getInlinedFrom() { return Optional.ofNullable(inlinedFrom); }
  public void setInlinedFrom(ModuleInstantiation inlinedFrom) { this.inlinedFrom = inlinedFrom; }

  @Override
  public List<Node> children() {
    return new ArrayList<>(items);
  }

  @Override
  public GenerateBlock clone() {
    return cloneAs(id);
  }
}
