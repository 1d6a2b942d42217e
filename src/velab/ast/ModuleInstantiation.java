package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code Mid #(params) iid (ports);}
 * After elaboration the instantiation owns its elaborated instance (see {@link #getInstance()}).
 */
public class ModuleInstantiation extends ModuleItem {
  private final Attributes attrs;
  private final Identifier mid;
  private final Identifier iid;
  private final NodeList<ArgAssign> params = new NodeList<>(this);
  private final NodeList<ArgAssign> ports = new NodeList<>(this);
  private ModuleDeclaration instance = null;

  public ModuleInstantiation(Attributes attrs, Identifier mid, Identifier iid, List<ArgAssign> params, List<ArgAssign> ports) {
    if (iid.isHierarchical())
      throw new IllegalArgumentException("instance names must not be hierarchical: " + iid);
    this.attrs = adopt(attrs);
    this.mid = mid;
    this.iid = iid;
    this.params.addAll(params);
    this.ports.addAll(ports);
  }
  public ModuleInstantiation(String module, String instance) {
    this(new Attributes(), new Identifier(module), new Identifier(instance), List.of(), List.of());
  }

  public Attributes getAttrs() { return attrs; }
  public Identifier getMid() { return mid; }
  public Identifier getIid() { return iid; }
  public NodeList<ArgAssign> getParams() { return params; }
  public NodeList<ArgAssign> getPorts() { return ports; }

  public Optional<ModuleDeclaration> getInstance() { return Optional.ofNullable(instance); }
  public boolean isElaborated() { return instance != null; }

  /** Attaches (or with null, detaches) the elaborated instance. */
  public void setInstance(ModuleDeclaration instance) {
    if (this.instance != null)
      this.instance.setParent(null);
    this.instance = adopt(instance);
  }

  @Override
  public List<Node> children() {
    List<Node> ret = new ArrayList<>(1 + params.size() + ports.size());
    ret.add(attrs);
    ret.addAll(params);
    ret.addAll(ports);
    return ret;
  }

  @Override
  public List<Node> liveChildren() {
    List<Node> ret = children();
    if (instance != null)
      ret.add(instance);
    return ret;
  }

  @Override
  public ModuleInstantiation clone() {
    ModuleInstantiation ret = new ModuleInstantiation(attrs.clone(), mid, iid, List.of(), List.of());
    ret.params.addClonesOf(params);
    ret.ports.addClonesOf(ports);
    return ret;
  }
}
