package velab.util;

/** Classifies reported diagnostics. */
public enum ErrorKind {
  /** A declaration for the module type already exists. */
  DuplicateDeclaration,
  /** Code was evaluated before the root module was instantiated, or the root instantiation names the wrong module. */
  MissingRootDeclaration,
  /** Reported by the semantic checker or while expanding the hierarchy. */
  SemanticError;
}
