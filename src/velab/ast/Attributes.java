package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Ordered attribute list, e.g. {@code (* __no_inline, target = "x" *)}. */
public class Attributes extends Node {
  private final NodeList<AttrSpec> as = new NodeList<>(this);

  public Attributes() {}
  public Attributes(List<AttrSpec> specs) { as.addAll(specs); }

  public NodeList<AttrSpec> getAs() { return as; }
  public boolean isEmpty() { return as.isEmpty(); }

  public Optional<AttrSpec> get(String name) {
    Identifier key = new Identifier(name);
    return as.stream().filter(spec -> spec.getName().equals(key)).findFirst();
  }

  public boolean has(String name) { return get(name).isPresent(); }

  /** Copies every entry of other into this list, replacing entries with the same name. */
  public void setOrReplace(Attributes other) {
    for (AttrSpec spec : other.as) {
      int existing = -1;
      for (int i = 0; i < as.size(); ++i) {
        if (as.get(i).getName().equals(spec.getName())) {
          existing = i;
          break;
        }
      }
      if (existing >= 0)
        as.set(existing, spec.clone());
      else
        as.add(spec.clone());
    }
  }

  @Override
  public List<Node> children() {
    return new ArrayList<>(as);
  }

  @Override
  public Attributes clone() {
    Attributes ret = new Attributes();
    ret.as.addClonesOf(as);
    return ret;
  }
}
