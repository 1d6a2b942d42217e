package velab.program;

import java.util.ArrayList;
import java.util.List;
import velab.analyze.Evaluate;
import velab.ast.Declaration;
import velab.ast.GenerateConstruct;
import velab.ast.ModuleInstantiation;
import velab.ast.Node;

/**
 * Result of traversing a subtree for elaboration work: every instantiation and every generate construct, in traversal order.
 * The traversal does not descend into either (their contents are only traversed once expanded)
 * and computes initial values of the declarations it passes.
 */
record Discovery(List<ModuleInstantiation> instantiations, List<GenerateConstruct> generates) {
  static Discovery of(Node root) {
    Discovery ret = new Discovery(new ArrayList<>(), new ArrayList<>());
    ret.visit(root, new Evaluate());
    return ret;
  }

  private void visit(Node node, Evaluate eval) {
    if (node instanceof ModuleInstantiation) {
      instantiations.add((ModuleInstantiation)node);
      return;
    }
    if (node instanceof GenerateConstruct) {
      generates.add((GenerateConstruct)node);
      return;
    }
    if (node instanceof Declaration) {
      eval.initValue((Declaration)node);
      return;
    }
    for (Node child : node.children())
      visit(child, eval);
  }

  /** Appends the discovered nodes to the given worklists. */
  void appendTo(List<ModuleInstantiation> instQueue, List<GenerateConstruct> genQueue) {
    instQueue.addAll(instantiations);
    genQueue.addAll(generates);
  }
}
