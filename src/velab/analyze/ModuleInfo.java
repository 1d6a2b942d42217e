package velab.analyze;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import velab.ast.GenerateBlock;
import velab.ast.GenerateConstruct;
import velab.ast.Identifier;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.Node;
import velab.ast.PortDeclaration;
import velab.ast.PortDeclaration.Direction;

/**
 * Summary of an elaborated instance: its child instances and its ports.
 * The summary is cached on the declaration and must be invalidated whenever the hierarchy changes shape.
 */
public class ModuleInfo {
  private static final class Summary {
    final LinkedHashMap<Identifier, ModuleInstantiation> children = new LinkedHashMap<>();
    final List<PortDeclaration> inputs = new ArrayList<>();
    final List<PortDeclaration> outputs = new ArrayList<>();
  }

  private final ModuleDeclaration md;

  public ModuleInfo(ModuleDeclaration md) { this.md = md; }

  /** Child instantiations keyed by their full hierarchical identifier, in source order. */
  public Map<Identifier, ModuleInstantiation> children() { return Collections.unmodifiableMap(summary().children); }

  /** Input and inout ports. */
  public List<PortDeclaration> inputs() { return Collections.unmodifiableList(summary().inputs); }

  /** Output and inout ports. */
  public List<PortDeclaration> outputs() { return Collections.unmodifiableList(summary().outputs); }

  public void invalidate() { md.dropCache(Summary.class); }

  private Summary summary() {
    Optional<Summary> cached = md.getCache(Summary.class);
    if (cached.isPresent())
      return cached.get();
    Summary ret = new Summary();
    for (PortDeclaration port : md.getPorts()) {
      if (port.getDirection() != Direction.OUTPUT)
        ret.inputs.add(port);
      if (port.getDirection() != Direction.INPUT)
        ret.outputs.add(port);
    }
    collectChildren(md.getItems(), new Resolve(), ret);
    md.setCache(Summary.class, ret);
    return ret;
  }

  private static void collectChildren(List<? extends Node> items, Resolve resolve, Summary summary) {
    for (Node item : items) {
      if (item instanceof ModuleInstantiation) {
        summary.children.put(resolve.getFullId(item), (ModuleInstantiation)item);
      } else if (item instanceof GenerateBlock) {
        collectChildren(((GenerateBlock)item).getItems(), resolve, summary);
      } else if (item instanceof GenerateConstruct) {
        collectChildren(((GenerateConstruct)item).getGenerated(), resolve, summary);
      }
    }
  }
}
