package velab.program;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import velab.analyze.EvaluationException;
import velab.analyze.Inline;
import velab.analyze.ModuleInfo;
import velab.analyze.Navigate;
import velab.analyze.Resolve;
import velab.ast.Attributes;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.Identifier;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.ModuleItem;
import velab.ast.Node;
import velab.ast.NodeList;
import velab.ui.ElabConfig;
import velab.util.ErrorKind;
import velab.util.Loggable;

/**
 * A design under incremental elaboration.
 * Holds the table of module declarations and the table of elaborated instances (keyed by full hierarchical id).
 * The first declared module is the root; evaluating an instantiation of it creates the root instance,
 * after which every evaluated item is appended to the root instance and elaborated in place.
 * Every public operation either succeeds completely or leaves both tables and the hierarchy unchanged;
 * the outcome is reported through the diagnostics of this {@link Loggable}.
 */
public class Program extends Loggable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_MAX_LOOP_ITERATIONS = 65536;

  private final VersionedTable<Identifier, ModuleDeclaration> decls = new VersionedTable<>();
  private final VersionedTable<Identifier, ModuleDeclaration> elabs = new VersionedTable<>(Program::detachInstance);

  private Identifier rootDecl = null;
  private ModuleInstantiation rootInst = null;
  private ModuleDeclaration rootElab = null;

  private boolean checkerOff = false;
  private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;

  public Program() {}

  /** Declares md and instantiates it as the root. */
  public Program(ModuleDeclaration md) { declareAndInstantiate(md); }

  /** Declares md and evaluates mi as the root instantiation. */
  public Program(ModuleDeclaration md, ModuleInstantiation mi) {
    declare(md);
    if (error())
      return;
    eval(mi);
  }

  /** Enables or disables semantic checking. Missing module declarations are reported either way. */
  public Program typecheck(boolean enabled) {
    checkerOff = !enabled;
    return this;
  }

  public Program configure(ElabConfig config) {
    typecheck(config.typecheck);
    if (config.max_loop_iterations <= 0)
      throw new IllegalArgumentException("max_loop_iterations must be positive, is " + config.max_loop_iterations);
    maxLoopIterations = config.max_loop_iterations;
    return this;
  }

  public int getMaxLoopIterations() { return maxLoopIterations; }

  private static void detachInstance(ModuleDeclaration inst) {
    if (inst.getParent() instanceof ModuleInstantiation)
      ((ModuleInstantiation)inst.getParent()).setInstance(null);
  }

  //
  // Declaration registry
  //

  /**
   * Registers a module declaration.
   * The declaration is checked in isolation (references to names outside it are only warned about).
   * On error, the declaration is dropped.
   */
  public void declare(ModuleDeclaration md) {
    clearLogs();

    if (md.getAttrs().isEmpty() && rootDecl != null)
      md.replaceAttrs(decls.find(rootDecl).get().getAttrs().clone());
    elaborate(md, ElabMode.DECLARE);

    if (decls.contains(md.getId()))
      error(ErrorKind.DuplicateDeclaration, "Previous declaration already exists for module " + md.getId().readable());
    if (error()) {
      logger.debug("Declaration of {} rejected", md.getId());
      return;
    }

    decls.checkpoint();
    decls.insert(md.getId(), md);
    decls.commit();
    if (decls.size() == 1)
      rootDecl = md.getId();
    logger.debug("Declared module {}", md.getId());
  }

  /** Declares md, then evaluates an instantiation of it named after the lower-cased module name. */
  public void declareAndInstantiate(ModuleDeclaration md) {
    declare(md);
    if (error())
      return;
    String iid = md.getId().front().name().toLowerCase(Locale.ROOT);
    eval(new ModuleInstantiation(new Attributes(), md.getId(), new Identifier(iid), List.of(), List.of()));
  }

  //
  // Hierarchy evaluator
  //

  /**
   * Evaluates a module item. The first evaluated item must instantiate the root module;
   * every later item is added to the root instance.
   */
  public void eval(ModuleItem item) {
    clearLogs();
    if (elabs.isEmpty())
      evalRoot(item);
    else
      evalItem(item);
  }

  private void evalRoot(ModuleItem item) {
    elabs.checkpoint();
    if (!(item instanceof ModuleInstantiation) || rootDecl == null || !((ModuleInstantiation)item).getMid().equals(rootDecl))
      error(ErrorKind.MissingRootDeclaration, "Cannot evaluate code without first instantiating the root module");
    else
      elaborate(item, ElabMode.EVALUATE);
    if (error()) {
      elabs.undo();
      return;
    }
    elabs.commit();

    rootInst = (ModuleInstantiation)item;
    rootElab = elabs.first().get().getValue();
    logger.debug("Instantiated root module {} as {}", rootInst.getMid(), rootInst.getIid());
  }

  private void evalItem(ModuleItem item) {
    NodeList<ModuleItem> items = rootElab.getItems();
    items.add(item);
    new Navigate(rootElab).invalidate();

    elabs.checkpoint();
    elaborate(item, ElabMode.EVALUATE);

    if (error()) {
      elabs.undo();
      // References into the rejected item and the scope entries it introduced.
      new Resolve().invalidate(item);
      new Navigate(rootElab).invalidate();
      items.purgeTo(items.size() - 1);
      logger.debug("Evaluation rejected, {} error(s)", getErrors().size());
    } else {
      elabs.commit();
    }

    // The shape of any instance in the hierarchy may have changed.
    for (ModuleDeclaration inst : elabs.values())
      new ModuleInfo(inst).invalidate();
  }

  //
  // Worklist engine
  //

  /**
   * Expands the subtree rooted at node according to mode, breadth first by hierarchy level:
   * all pending instantiations, then all pending generate constructs, until neither produces more work.
   * Stops at the first error; the caller is responsible for rolling back.
   */
  void elaborate(Node node, ElabMode mode) {
    TypeCheck tc = new TypeCheck(this);
    tc.deactivate(checkerOff);
    tc.warnUnresolved(mode.warnUnresolved());
    tc.localOnly(mode.localOnly());
    Elaborate specializer = new Elaborate(this);

    List<ModuleInstantiation> instQueue = new ArrayList<>();
    List<GenerateConstruct> genQueue = new ArrayList<>();
    Discovery.of(node).appendTo(instQueue, genQueue);

    try {
      while (!error() && (!instQueue.isEmpty() || !genQueue.isEmpty())) {
        for (int i = 0; !error() && i < instQueue.size(); ++i) {
          ModuleInstantiation mi = instQueue.get(i);
          tc.preElaborationCheck(mi);
          copyLogs(tc);
          if (!error() && mode.expandInstantiations())
            expand(mi, specializer, instQueue, genQueue);
        }
        instQueue.clear();

        // Generate constructs found while expanding these are handled before the instantiations they contain.
        // This only matters for deferred parameter redefinition, which is not supported.
        for (int i = 0; !error() && i < genQueue.size(); ++i) {
          GenerateConstruct gc = genQueue.get(i);
          tc.preElaborationCheck(gc);
          copyLogs(tc);
          if (!error() && mode.expandGenerates()) {
            for (GenerateBlock block : specializer.elaborate(gc))
              Discovery.of(block).appendTo(instQueue, genQueue);
            new Navigate(gc).invalidate();
            logger.trace("Expanded {} generate construct into {} block(s)", gc.getKind(), gc.getGenerated().size());
          }
        }
        genQueue.clear();
      }
    } catch (EvaluationException e) {
      error(e.getMessage());
    }

    if (!error()) {
      tc.postElaborationCheck(node);
      copyLogs(tc);
    }
  }

  private void expand(ModuleInstantiation mi, Elaborate specializer, List<ModuleInstantiation> instQueue,
                      List<GenerateConstruct> genQueue) {
    ModuleDeclaration inst = specializer.elaborate(mi);
    Discovery.of(inst).appendTo(instQueue, genQueue);
    Navigate nav = new Navigate(mi);
    if (!nav.lost())
      nav.invalidate();

    ModuleInstantiation attrSource = mi.getAttrs().isEmpty() ? outermostInstantiation(mi) : mi;
    inst.getAttrs().setOrReplace(attrSource.getAttrs());

    Identifier fullId = new Resolve().getFullId(mi);
    if (elabs.contains(fullId)) {
      mi.setInstance(null);
      error("An instance named " + fullId.readable() + " already exists");
      return;
    }
    elabs.insert(fullId, inst);
    logger.debug("Elaborated {} as instance of {}", fullId, mi.getMid());
  }

  private static ModuleInstantiation outermostInstantiation(ModuleInstantiation mi) {
    ModuleInstantiation ret = mi;
    for (Optional<ModuleInstantiation> anc = mi.findAncestor(ModuleInstantiation.class); anc.isPresent();
         anc = anc.get().findAncestor(ModuleInstantiation.class))
      ret = anc.get();
    return ret;
  }

  //
  // Hierarchy transformer
  //

  /** Inlines every inlinable instance of the hierarchy into its parent, bottom up. */
  public void inlineAll() {
    if (rootElab != null)
      inlineAll(rootElab);
  }

  /** Undoes {@link #inlineAll()}, top down. */
  public void outlineAll() {
    if (rootElab != null)
      outlineAll(rootElab);
  }

  private void inlineAll(ModuleDeclaration md) {
    Inline inline = new Inline();
    if (!inline.canInline(md))
      return;
    for (Identifier child : List.copyOf(new ModuleInfo(md).children().keySet()))
      inlineAll(requireElab(child));
    inline.inlineSource(md);
  }

  private void outlineAll(ModuleDeclaration md) {
    Inline inline = new Inline();
    if (!inline.canInline(md))
      return;
    inline.outlineSource(md);
    for (Identifier child : List.copyOf(new ModuleInfo(md).children().keySet()))
      outlineAll(requireElab(child));
  }

  private ModuleDeclaration requireElab(Identifier fullId) {
    return elabs.find(fullId).orElseThrow(
        () -> new IllegalStateException("Child instance " + fullId.readable() + " missing from the elaborated table"));
  }

  //
  // Queries
  //

  /** The root instance, if the root module has been instantiated. */
  public Optional<ModuleDeclaration> src() { return Optional.ofNullable(rootElab); }

  public Optional<ModuleDeclaration> rootDecl() { return (rootDecl == null) ? Optional.empty() : decls.find(rootDecl); }

  public Optional<ModuleInstantiation> getRootInstantiation() { return Optional.ofNullable(rootInst); }

  public Optional<ModuleDeclaration> declFind(Identifier id) { return decls.find(id); }

  /** Declarations by module name, in declaration order. */
  public Map<Identifier, ModuleDeclaration> getDecls() { return decls.asMap(); }

  public Optional<ModuleDeclaration> elabFind(Identifier fullId) { return elabs.find(fullId); }

  /** Elaborated instances by full hierarchical id; the root instance comes first. */
  public Map<Identifier, ModuleDeclaration> getElabs() { return elabs.asMap(); }
}
