package velab.ast;

import java.util.ArrayList;
import java.util.List;

/** One arm of a case generate construct. An arm without values is the default arm. */
public class CaseGenerateItem extends Node {
  private final NodeList<Expression> values = new NodeList<>(this);
  private final GenerateBlock block;

  public CaseGenerateItem(List<Expression> values, GenerateBlock block) {
    this.values.addAll(values);
    this.block = adopt(block);
  }

  public NodeList<Expression> getValues() { return values; }
  public GenerateBlock getBlock() { return block; }
  public boolean isDefault() { return values.isEmpty(); }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(values);
    ret.add(block);
    return ret;
  }

  @Override
  public CaseGenerateItem clone() {
    CaseGenerateItem ret = new CaseGenerateItem(List.of(), block.clone());
    ret.values.addClonesOf(values);
    return ret;
  }
}
