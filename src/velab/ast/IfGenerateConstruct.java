package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@code if (cond) then_block else else_block} at module level. */
public class IfGenerateConstruct extends GenerateConstruct {
  private final Expression cond;
  private final GenerateBlock thenBlock;
  private final GenerateBlock elseBlock;

  public IfGenerateConstruct(Expression cond, GenerateBlock thenBlock, GenerateBlock elseBlock) {
    this.cond = adopt(cond);
    this.thenBlock = adopt(thenBlock);
    this.elseBlock = adopt(elseBlock);
  }

  public Expression getCond() { return cond; }
  public GenerateBlock getThen() { return thenBlock; }
  public Optional<GenerateBlock> getElse() { return Optional.ofNullable(elseBlock); }

  @Override
  public Kind getKind() {
    return Kind.IF;
  }

  @Override
  protected List<Node> headerChildren() {
    return List.of(cond);
  }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(3);
    ret.add(cond);
    ret.add(thenBlock);
    if (elseBlock != null)
      ret.add(elseBlock);
    return ret;
  }

  @Override
  public IfGenerateConstruct clone() {
    return new IfGenerateConstruct(cond.clone(), thenBlock.clone(), elseBlock == null ? null : elseBlock.clone());
  }
}
