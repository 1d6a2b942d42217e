package velab.ast;

import java.util.List;

/**
 * {@code for (genvar = init; cond; genvar = update) body}
 * Each iteration produces a copy of body named {@code body_name[value]}.
 */
public class LoopGenerateConstruct extends GenerateConstruct {
  private final IdentifierRef genvar;
  private final Expression init;
  private final Expression cond;
  private final Expression update;
  private final GenerateBlock body;

  public LoopGenerateConstruct(IdentifierRef genvar, Expression init, Expression cond, Expression update, GenerateBlock body) {
    this.genvar = adopt(genvar);
    this.init = adopt(init);
    this.cond = adopt(cond);
    this.update = adopt(update);
    this.body = adopt(body);
  }

  public IdentifierRef getGenvar() { return genvar; }
  public Expression getInit() { return init; }
  public Expression getCond() { return cond; }
  public Expression getUpdate() { return update; }
  public GenerateBlock getBody() { return body; }

  @Override
  public Kind getKind() {
    return Kind.LOOP;
  }

  @Override
  protected List<Node> headerChildren() {
    return List.of(genvar, init, cond, update);
  }

  @Override
  public List<Node> children() {
    return List.of(genvar, init, cond, update, body);
  }

  @Override
  public LoopGenerateConstruct clone() {
    return new LoopGenerateConstruct(genvar.clone(), init.clone(), cond.clone(), update.clone(), body.clone());
  }
}
