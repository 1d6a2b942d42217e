package velab.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, possibly hierarchical name such as {@code top.blk[2].u0}.
 * Identifiers compare by their segments, never by object identity.
 */
public final class Identifier {
  /** One segment of an identifier, with an optional index (used for generate loop blocks). */
  public static record Id(String name, Optional<Integer> index) {
    public Id {
      Objects.requireNonNull(name);
      Objects.requireNonNull(index);
      if (name.isEmpty())
        throw new IllegalArgumentException("identifier segment must not be empty");
      if (name.indexOf('.') >= 0 || name.indexOf('[') >= 0 || name.indexOf(']') >= 0)
        throw new IllegalArgumentException("identifier segment must not contain '.', '[' or ']': " + name);
    }
    public Id(String name) { this(name, Optional.empty()); }
    public Id(String name, int index) { this(name, Optional.of(index)); }

    @Override
    public String toString() {
      return index.map(i -> name + "[" + i + "]").orElse(name);
    }
  }

  private final List<Id> ids;

  public Identifier(List<Id> ids) {
    if (ids.isEmpty())
      throw new IllegalArgumentException("identifier must have at least one segment");
    this.ids = List.copyOf(ids);
  }
  public Identifier(Id id) { this(List.of(id)); }
  public Identifier(String name) { this(new Id(name)); }

  /**
   * Parses the readable form, e.g. {@code a.b[1].c}.
   * @param readable dotted path, segments optionally suffixed with a decimal index
   * @return the parsed identifier
   */
  public static Identifier parse(String readable) {
    List<Id> ids = new ArrayList<>();
    for (String seg : readable.split("\\.", -1)) {
      int bracket = seg.indexOf('[');
      if (bracket < 0) {
        ids.add(new Id(seg));
        continue;
      }
      if (!seg.endsWith("]"))
        throw new IllegalArgumentException("Malformed identifier segment '" + seg + "' in " + readable);
      try {
        ids.add(new Id(seg.substring(0, bracket), Integer.parseInt(seg.substring(bracket + 1, seg.length() - 1))));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Malformed index in '" + seg + "' of " + readable, e);
      }
    }
    return new Identifier(ids);
  }

  public List<Id> getIds() { return ids; }
  public Id front() { return ids.get(0); }
  public Id back() { return ids.get(ids.size() - 1); }
  public int size() { return ids.size(); }
  public boolean isHierarchical() { return ids.size() > 1; }

  /** Returns the identifier without its first segment, or empty for a single-segment identifier. */
  public Optional<Identifier> rest() {
    if (ids.size() == 1)
      return Optional.empty();
    return Optional.of(new Identifier(ids.subList(1, ids.size())));
  }

  public Identifier append(Id id) {
    List<Id> appended = new ArrayList<>(ids);
    appended.add(id);
    return new Identifier(appended);
  }

  public Identifier append(Identifier other) {
    List<Id> appended = new ArrayList<>(ids);
    appended.addAll(other.ids);
    return new Identifier(appended);
  }

  public String readable() {
    StringBuilder sb = new StringBuilder();
    for (Id id : ids) {
      if (sb.length() > 0)
        sb.append('.');
      sb.append(id);
    }
    return sb.toString();
  }

  @Override
  public int hashCode() {
    return ids.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    return ids.equals(((Identifier)obj).ids);
  }

  @Override
  public String toString() {
    return readable();
  }
}
