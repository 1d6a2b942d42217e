package velab.program;

import java.util.List;
import java.util.Optional;
import velab.analyze.Evaluate;
import velab.analyze.Navigate;
import velab.analyze.Resolve;
import velab.ast.ArgAssign;
import velab.ast.Attributes;
import velab.ast.CaseGenerateConstruct;
import velab.ast.CaseGenerateItem;
import velab.ast.ContinuousAssign;
import velab.ast.Declaration;
import velab.ast.Expression;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.GenvarDeclaration;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.IfGenerateConstruct;
import velab.ast.LoopGenerateConstruct;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.NetDeclaration;
import velab.ast.Node;
import velab.ast.ParameterDeclaration;
import velab.ast.PortDeclaration;
import velab.util.Loggable;

/**
 * Semantic checker consulted by the elaboration loop.
 * Every check starts from an empty log; the caller copies the diagnostics it is interested in.
 */
public class TypeCheck extends Loggable {
  private final Program program;
  private boolean deactivated = false;
  private boolean warnUnresolved = false;
  private boolean localOnly = false;

  public TypeCheck(Program program) { this.program = program; }

  /** A deactivated checker only reports what would make elaboration impossible (unknown modules). */
  public void deactivate(boolean deactivated) { this.deactivated = deactivated; }
  public void warnUnresolved(boolean warnUnresolved) { this.warnUnresolved = warnUnresolved; }
  public void localOnly(boolean localOnly) { this.localOnly = localOnly; }

  private Resolve resolve() { return new Resolve(localOnly); }

  public void preElaborationCheck(ModuleInstantiation mi) {
    clearLogs();
    Optional<ModuleDeclaration> decl = program.declFind(mi.getMid());
    if (decl.isEmpty()) {
      error("Unable to locate declaration for module " + mi.getMid().readable());
      return;
    }
    if (deactivated)
      return;

    for (Optional<ModuleInstantiation> anc = mi.findAncestor(ModuleInstantiation.class); anc.isPresent();
         anc = anc.get().findAncestor(ModuleInstantiation.class)) {
      if (anc.get().getMid().equals(mi.getMid())) {
        error("Recursive instantiation of module " + mi.getMid().readable() + " in " + anc.get().getIid().readable());
        return;
      }
    }
    checkUniqueName(mi, mi.getIid());

    List<ParameterDeclaration> params = decl.get()
                                            .getItems()
                                            .stream()
                                            .filter(item -> item instanceof ParameterDeclaration)
                                            .map(item -> (ParameterDeclaration)item)
                                            .toList();
    checkArgs(mi, mi.getParams(), params, "parameter");
    checkArgs(mi, mi.getPorts(), decl.get().getPorts(), "port");

    Evaluate eval = new Evaluate(resolve());
    for (ArgAssign override : mi.getParams()) {
      if (override.getImp().isPresent() && !eval.isConstant(override.getImp().get()))
        error("Non-constant value for parameter override in instantiation of " + mi.getIid().readable());
    }
  }

  private void checkArgs(ModuleInstantiation mi, List<ArgAssign> args, List<? extends Declaration> formals, String what) {
    boolean named = args.stream().anyMatch(arg -> arg.isNamed());
    boolean ordered = args.stream().anyMatch(arg -> !arg.isNamed());
    String where = " in instantiation " + mi.getIid().readable() + " of " + mi.getMid().readable();
    if (named && ordered) {
      error("Cannot mix named and ordered " + what + " connections" + where);
      return;
    }
    if (ordered && args.size() > formals.size()) {
      error("Too many " + what + " connections" + where + ": " + args.size() + " given, " + formals.size() + " declared");
      return;
    }
    for (ArgAssign arg : args) {
      if (!arg.isNamed())
        continue;
      Identifier name = arg.getExp().get();
      if (formals.stream().noneMatch(formal -> formal.getId().equals(name)))
        error("Module " + mi.getMid().readable() + " has no " + what + " named " + name.readable() + where);
    }
  }

  public void preElaborationCheck(GenerateConstruct gc) {
    clearLogs();
    if (deactivated)
      return;
    Resolve resolve = resolve();
    Evaluate eval = new Evaluate(resolve);
    switch (gc.getKind()) {
    case CASE: {
      CaseGenerateConstruct cgc = (CaseGenerateConstruct)gc;
      checkConstant(eval, cgc.getSelector(), "case generate selector");
      for (CaseGenerateItem item : cgc.getItems()) {
        for (Expression value : item.getValues())
          checkConstant(eval, value, "case generate item");
      }
      break;
    }
    case IF:
      checkConstant(eval, ((IfGenerateConstruct)gc).getCond(), "if generate condition");
      break;
    case LOOP: {
      LoopGenerateConstruct lgc = (LoopGenerateConstruct)gc;
      Optional<Declaration> genvar = resolve.getResolution(lgc.getGenvar());
      if (genvar.isEmpty() || !(genvar.get() instanceof GenvarDeclaration)) {
        error("Loop generate construct iterates over " + lgc.getGenvar().getId().readable() + ", which is not a declared genvar");
        return;
      }
      checkConstant(eval, lgc.getInit(), "loop generate initialization");
      checkConstant(eval, lgc.getCond(), "loop generate condition");
      checkConstant(eval, lgc.getUpdate(), "loop generate update");
      break;
    }
    }
  }

  private void checkConstant(Evaluate eval, Expression expr, String what) {
    if (!eval.isConstant(expr))
      error("The " + what + " " + expr + " is not a constant expression");
  }

  /**
   * Checks the (elaborated) subtree rooted at node: references must resolve, continuous assignments must target nets,
   * and names must be unique per scope.
   */
  public void postElaborationCheck(Node node) {
    clearLogs();
    if (deactivated)
      return;
    Resolve resolve = resolve();
    node.walk(n -> {
      if (n instanceof IdentifierRef)
        checkReference(resolve, (IdentifierRef)n);
      else if (n instanceof ContinuousAssign)
        checkAssign(resolve, (ContinuousAssign)n);
      else if (n instanceof Declaration)
        checkUniqueName(n, ((Declaration)n).getId());
      else if (n instanceof GenerateBlock && ((GenerateBlock)n).isScope())
        checkUniqueName(n.getParent(), ((GenerateBlock)n).getId().get());
    });
  }

  private void checkReference(Resolve resolve, IdentifierRef ref) {
    if (ref.findAncestor(Attributes.class).isPresent() || resolve.getResolution(ref).isPresent())
      return;
    String msg = "Referenced an undeclared name " + ref.getId().readable();
    if (warnUnresolved)
      warn(msg);
    else
      error(msg);
  }

  private void checkAssign(Resolve resolve, ContinuousAssign ca) {
    Optional<Declaration> target = resolve.getResolution(ca.getLhs());
    if (target.isEmpty())
      return;
    boolean isNet = target.get() instanceof NetDeclaration ||
                    (target.get() instanceof PortDeclaration && !((PortDeclaration)target.get()).isReg());
    if (!isNet)
      error("Continuous assignment to " + ca.getLhs().getId().readable() + ", which is not a net");
  }

  private void checkUniqueName(Node node, Identifier id) {
    Navigate nav = new Navigate(node);
    if (nav.count(id.front()) > 1)
      error("A declaration named " + id.readable() + " already exists in this scope");
  }
}
