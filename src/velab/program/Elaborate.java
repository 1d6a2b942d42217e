package velab.program;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import velab.analyze.EvaluationException;
import velab.analyze.Evaluate;
import velab.analyze.Resolve;
import velab.ast.ArgAssign;
import velab.ast.CaseGenerateConstruct;
import velab.ast.CaseGenerateItem;
import velab.ast.Declaration;
import velab.ast.Expression;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.Identifier;
import velab.ast.IfGenerateConstruct;
import velab.ast.LocalparamDeclaration;
import velab.ast.LoopGenerateConstruct;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.Number;
import velab.ast.ParameterDeclaration;

/**
 * Specializer: turns instantiations into elaborated instances and generate constructs into the blocks they select.
 * Both operations are idempotent; the result is attached to the input node.
 */
public class Elaborate {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Base name of loop iteration blocks whose body has no name. */
  public static final String DEFAULT_BLOCK_NAME = "genblk";

  private final Program program;

  public Elaborate(Program program) { this.program = program; }

  /**
   * Clones the declaration of mi's module, binds mi's parameter overrides and attaches the clone to mi.
   * Override expressions are evaluated in the scope of the instantiation.
   * @return the elaborated instance
   * @throws EvaluationException if an override cannot be evaluated
   */
  public ModuleDeclaration elaborate(ModuleInstantiation mi) {
    if (mi.isElaborated())
      return mi.getInstance().get();
    ModuleDeclaration decl = program.declFind(mi.getMid()).orElseThrow(
        () -> new IllegalStateException("No declaration for module " + mi.getMid().readable()));

    ModuleDeclaration inst = decl.clone();
    List<ParameterDeclaration> params = inst.getItems()
                                            .stream()
                                            .filter(item -> item instanceof ParameterDeclaration)
                                            .map(item -> (ParameterDeclaration)item)
                                            .toList();
    Evaluate outer = new Evaluate();
    for (int i = 0; i < mi.getParams().size(); ++i) {
      ArgAssign override = mi.getParams().get(i);
      if (override.getImp().isEmpty())
        continue;
      ParameterDeclaration target = findParam(params, override, i, mi);
      long value = outer.getValue(override.getImp().get());
      logger.trace("{}: binding parameter {} = {}", mi.getIid(), target.getId(), value);
      target.replaceValue(new Number(value));
      Evaluate.invalidate(target);
    }
    mi.setInstance(inst);
    return inst;
  }

  private static ParameterDeclaration findParam(List<ParameterDeclaration> params, ArgAssign override, int index,
                                                ModuleInstantiation mi) {
    if (override.isNamed()) {
      Identifier name = override.getExp().get();
      return params.stream()
          .filter(param -> param.getId().equals(name))
          .findFirst()
          .orElseThrow(() -> new EvaluationException("Module " + mi.getMid().readable() + " has no parameter " + name.readable()));
    }
    if (index >= params.size())
      throw new EvaluationException("Too many parameter overrides for module " + mi.getMid().readable());
    return params.get(index);
  }

  /**
   * Expands a generate construct and stores the produced blocks on it.
   * @return the produced blocks (possibly none)
   * @throws EvaluationException if a condition or bound cannot be evaluated, or a loop does not terminate
   */
  public List<GenerateBlock> elaborate(GenerateConstruct gc) {
    if (gc.isElaborated())
      return gc.getGenerated();
    List<GenerateBlock> blocks;
    switch (gc.getKind()) {
    case CASE:
      blocks = elaborateCase((CaseGenerateConstruct)gc);
      break;
    case IF:
      blocks = elaborateIf((IfGenerateConstruct)gc);
      break;
    case LOOP:
      blocks = elaborateLoop((LoopGenerateConstruct)gc);
      break;
    default:
      throw new IllegalStateException("unhandled generate construct " + gc.getKind());
    }
    gc.setGenerated(blocks);
    return gc.getGenerated();
  }

  private List<GenerateBlock> elaborateCase(CaseGenerateConstruct cgc) {
    Evaluate eval = new Evaluate();
    long selector = eval.getValue(cgc.getSelector());
    CaseGenerateItem fallback = null;
    for (CaseGenerateItem item : cgc.getItems()) {
      if (item.isDefault()) {
        if (fallback == null)
          fallback = item;
        continue;
      }
      for (Expression value : item.getValues()) {
        if (eval.getValue(value) == selector)
          return List.of(item.getBlock().clone());
      }
    }
    return (fallback == null) ? List.of() : List.of(fallback.getBlock().clone());
  }

  private List<GenerateBlock> elaborateIf(IfGenerateConstruct igc) {
    if (new Evaluate().getValue(igc.getCond()) != 0)
      return List.of(igc.getThen().clone());
    return igc.getElse().map(block -> List.of(block.clone())).orElse(List.of());
  }

  private List<GenerateBlock> elaborateLoop(LoopGenerateConstruct lgc) {
    Declaration genvar = new Resolve().getResolution(lgc.getGenvar()).orElseThrow(
        () -> new EvaluationException("Unable to resolve genvar " + lgc.getGenvar().getId().readable()));
    String blockName = lgc.getBody().getId().map(id -> id.front().name()).orElse(DEFAULT_BLOCK_NAME);
    int maxIterations = program.getMaxLoopIterations();

    Evaluate eval = new Evaluate();
    List<GenerateBlock> blocks = new ArrayList<>();
    long value = eval.getValue(lgc.getInit());
    while (eval.bind(genvar, value).getValue(lgc.getCond()) != 0) {
      if (blocks.size() >= maxIterations)
        throw new EvaluationException("Generate loop over " + genvar.getId().readable() + " did not terminate within " + maxIterations +
                                      " iterations");
      if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)
        throw new EvaluationException("Genvar " + genvar.getId().readable() + " out of range: " + value);
      GenerateBlock block = lgc.getBody().cloneAs(new Identifier(new Identifier.Id(blockName, (int)value)));
      block.getItems().add(0, new LocalparamDeclaration(genvar.getId(), new Number(value)));
      blocks.add(block);
      value = eval.getValue(lgc.getUpdate());
    }
    logger.trace("Loop over {} produced {} blocks", genvar.getId(), blocks.size());
    return blocks;
  }
}
