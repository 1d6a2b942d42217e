package velab.ast;

import java.util.ArrayList;
import java.util.List;

/** {@code case (selector) ... endcase} at module level. */
public class CaseGenerateConstruct extends GenerateConstruct {
  private final Expression selector;
  private final NodeList<CaseGenerateItem> items = new NodeList<>(this);

  public CaseGenerateConstruct(Expression selector, List<CaseGenerateItem> items) {
    this.selector = adopt(selector);
    this.items.addAll(items);
  }

  public Expression getSelector() { return selector; }
  public NodeList<CaseGenerateItem> getItems() { return items; }

  @Override
  public Kind getKind() {
    return Kind.CASE;
  }

  @Override
  protected List<Node> headerChildren() {
    return List.of(selector);
  }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(1 + items.size());
    ret.add(selector);
    ret.addAll(items);
    return ret;
  }

  @Override
  public CaseGenerateConstruct clone() {
    CaseGenerateConstruct ret = new CaseGenerateConstruct(selector.clone(), List.of());
    ret.items.addClonesOf(items);
    return ret;
  }
}
