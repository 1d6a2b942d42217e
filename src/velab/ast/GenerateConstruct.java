package velab.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Conditional, multi-way or iterative generate construct.
 * Expansion stores the produced blocks on the construct and leaves the template blocks untouched.
 */
public abstract class GenerateConstruct extends ModuleItem {
  public enum Kind {
    CASE,
    IF,
    LOOP;
  }

  private List<GenerateBlock> generated = null;

  public abstract Kind getKind();

  /** The expressions that control expansion (conditions, selectors, loop bounds). */
  protected abstract List<Node> headerChildren();

  public boolean isElaborated() { return generated != null; }

  /** The expanded blocks, empty if the construct was not expanded or selected nothing. */
  public List<GenerateBlock> getGenerated() { return generated == null ? List.of() : generated; }

  public void setGenerated(List<GenerateBlock> blocks) {
    if (generated != null)
      generated.forEach(block -> block.setParent(null));
    generated = new ArrayList<>(blocks);
    generated.forEach(this::adopt);
  }

  @Override
  public List<Node> liveChildren() {
    if (generated == null)
      return children();
    List<Node> ret = new ArrayList<>(headerChildren());
    ret.addAll(generated);
    return ret;
  }

  @Override
  public abstract GenerateConstruct clone();
}
