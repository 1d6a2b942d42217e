package velab.program;

/**
 * Flags for one elaboration run. Passed into every call, never kept between calls.
 * @param warnUnresolved report unresolved references as warnings instead of errors
 * @param localOnly restrict name resolution to the immediate scope
 * @param expandInstantiations specialize instantiations into elaborated instances
 * @param expandGenerates expand generate constructs
 */
public record ElabMode(boolean warnUnresolved, boolean localOnly, boolean expandInstantiations, boolean expandGenerates) {
  /** Static checking of a module declaration in isolation. */
  public static final ElabMode DECLARE = new ElabMode(true, true, false, false);
  /** Full hierarchical expansion. */
  public static final ElabMode EVALUATE = new ElabMode(false, false, true, true);
}
