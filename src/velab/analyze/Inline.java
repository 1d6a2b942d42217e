package velab.analyze;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import velab.ast.ArgAssign;
import velab.ast.ContinuousAssign;
import velab.ast.Expression;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.ModuleItem;
import velab.ast.NetDeclaration;
import velab.ast.Node;
import velab.ast.NodeList;
import velab.ast.PortDeclaration;
import velab.ast.RegDeclaration;

/**
 * In-place inlining and outlining of child instances.
 *
 * Inlining replaces an instantiation {@code M u(.a(x), .b(y));} by an unnamed wrapper block that holds
 * a block named {@code u} (one net per port of M followed by the items of u's elaborated instance) and
 * one continuous assignment per connection ({@code assign u.a = x;}, {@code assign y = u.b;}).
 * The wrapper remembers the instantiation, which outlining puts back together with the items.
 * Hierarchical names below u are the same before and after inlining.
 */
public class Inline {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Attribute that excludes a module from inlining. */
  public static final String NO_INLINE = "__no_inline";

  public boolean canInline(ModuleDeclaration md) { return !md.getAttrs().has(NO_INLINE); }

  /** Inlines every child of md whose elaborated instance can be inlined. */
  public void inlineSource(ModuleDeclaration md) {
    boolean changed = false;
    for (ModuleInstantiation mi : List.copyOf(new ModuleInfo(md).children().values())) {
      Optional<ModuleDeclaration> inst = mi.getInstance();
      if (inst.isEmpty() || !canInline(inst.get()))
        continue;
      inlineInstance(mi, inst.get());
      changed = true;
    }
    if (changed) {
      new Navigate(md).invalidate();
      new ModuleInfo(md).invalidate();
    }
  }

  /** Restores every child of md that was inlined by {@link #inlineSource(ModuleDeclaration)}. */
  public void outlineSource(ModuleDeclaration md) {
    List<GenerateBlock> inlined = new ArrayList<>();
    findInlined(md.getItems(), inlined);
    for (GenerateBlock wrapper : inlined)
      outlineBlock(wrapper);
    if (!inlined.isEmpty()) {
      new Navigate(md).invalidate();
      new ModuleInfo(md).invalidate();
    }
  }

  private void inlineInstance(ModuleInstantiation mi, ModuleDeclaration inst) {
    NodeList<ModuleItem> container = mi.getContainingItems().orElseThrow(
        () -> new IllegalStateException("Instantiation " + mi.getIid() + " is not part of a module body"));
    logger.trace("Inlining {} into {}", mi.getIid(), container.getOwner());

    // References into the instance will resolve to the synthesized nets from now on.
    new Resolve().invalidate(inst);

    GenerateBlock body = new GenerateBlock(mi.getIid(), List.of());
    for (PortDeclaration port : inst.getPorts())
      body.getItems().add(port.isReg() ? new RegDeclaration(port.getId(), null) : new NetDeclaration(port.getId(), null));
    List<ModuleItem> moved = new ArrayList<>(inst.getItems());
    inst.getItems().clear();
    body.getItems().addAll(moved);

    List<ModuleItem> wrapperItems = new ArrayList<>();
    wrapperItems.add(body);
    for (int i = 0; i < mi.getPorts().size(); ++i) {
      ArgAssign conn = mi.getPorts().get(i);
      Optional<PortDeclaration> port = findPort(inst, conn, i);
      if (port.isEmpty() || conn.getImp().isEmpty())
        continue;
      IdentifierRef portRef = new IdentifierRef(mi.getIid().append(port.get().getId()));
      Expression expr = conn.getImp().get();
      switch (port.get().getDirection()) {
      case INPUT:
        wrapperItems.add(new ContinuousAssign(portRef, expr.clone()));
        break;
      case OUTPUT:
        if (expr instanceof IdentifierRef)
          wrapperItems.add(new ContinuousAssign(((IdentifierRef)expr).clone(), portRef));
        else
          logger.warn("Output {} of inlined instance {} is connected to a non-name expression and is left unconnected",
                      port.get().getId(), mi.getIid());
        break;
      case INOUT:
        logger.warn("Inout {} of inlined instance {} is left unconnected", port.get().getId(), mi.getIid());
        break;
      }
    }
    GenerateBlock wrapper = new GenerateBlock(wrapperItems);
    container.set(container.indexOfNode(mi), wrapper);
    wrapper.setInlinedFrom(mi);

    new Navigate(inst).invalidate();
    new ModuleInfo(inst).invalidate();
  }

  private void outlineBlock(GenerateBlock wrapper) {
    ModuleInstantiation mi = wrapper.getInlinedFrom().get();
    ModuleDeclaration inst = mi.getInstance().orElseThrow(
        () -> new IllegalStateException("Inlined instantiation " + mi.getIid() + " has no elaborated instance"));
    NodeList<ModuleItem> container = wrapper.getContainingItems().orElseThrow(
        () -> new IllegalStateException("Inlined block " + mi.getIid() + " is not part of a module body"));
    logger.trace("Outlining {} from {}", mi.getIid(), container.getOwner());

    new Resolve().invalidate(wrapper);

    GenerateBlock body = (GenerateBlock)wrapper.getItems().get(0);
    int header = inst.getPorts().size();
    List<ModuleItem> moved = new ArrayList<>(body.getItems().subList(header, body.getItems().size()));
    body.getItems().clear();
    inst.getItems().addAll(moved);
    container.set(container.indexOfNode(wrapper), mi);
    wrapper.setInlinedFrom(null);

    new Navigate(inst).invalidate();
    new ModuleInfo(inst).invalidate();
  }

  private static Optional<PortDeclaration> findPort(ModuleDeclaration inst, ArgAssign conn, int index) {
    if (conn.isNamed()) {
      Identifier name = conn.getExp().get();
      return inst.getPorts().stream().filter(port -> port.getId().equals(name)).findFirst();
    }
    return (index < inst.getPorts().size()) ? Optional.of(inst.getPorts().get(index)) : Optional.empty();
  }

  /** Collects the wrappers of inlined instances, without looking inside them. */
  private static void findInlined(List<? extends Node> items, List<GenerateBlock> result) {
    for (Node item : items) {
      if (item instanceof GenerateBlock) {
        GenerateBlock block = (GenerateBlock)item;
        if (block.getInlinedFrom().isPresent())
          result.add(block);
        else
          findInlined(block.getItems(), result);
      } else if (item instanceof GenerateConstruct) {
        findInlined(((GenerateConstruct)item).getGenerated(), result);
      }
    }
  }
}
