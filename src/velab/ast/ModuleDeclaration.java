package velab.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A module body. Used both as the template registered for a module type and,
 * once cloned and specialized, as an elaborated instance whose parent is the instantiation it came from.
 */
public class ModuleDeclaration extends Node {
  private Attributes attrs;
  private final Identifier id;
  private final NodeList<PortDeclaration> ports = new NodeList<>(this);
  private final NodeList<ModuleItem> items = new NodeList<>(this);

  public ModuleDeclaration(Attributes attrs, Identifier id, List<PortDeclaration> ports, List<ModuleItem> items) {
    this.attrs = adopt(attrs);
    this.id = id;
    this.ports.addAll(ports);
    this.items.addAll(items);
  }
  public ModuleDeclaration(String name, List<PortDeclaration> ports, List<ModuleItem> items) {
    this(new Attributes(), new Identifier(name), ports, items);
  }

  public Attributes getAttrs() { return attrs; }
  public Identifier getId() { return id; }
  public NodeList<PortDeclaration> getPorts() { return ports; }
  public NodeList<ModuleItem> getItems() { return items; }

  public void replaceAttrs(Attributes attrs) {
    this.attrs.setParent(null);
    this.attrs = adopt(attrs);
  }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(1 + ports.size() + items.size());
    ret.add(attrs);
    ret.addAll(ports);
    ret.addAll(items);
    return ret;
  }

  @Override
  public ModuleDeclaration clone() {
    ModuleDeclaration ret = new ModuleDeclaration(attrs.clone(), id, List.of(), List.of());
    ret.ports.addClonesOf(ports);
    ret.items.addClonesOf(items);
    return ret;
  }
}
