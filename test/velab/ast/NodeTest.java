package velab.ast;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NodeTest {
  @Test
  void testParentsFollowLists() {
    ModuleDeclaration md = new ModuleDeclaration("M", List.of(), List.of());
    NetDeclaration a = new NetDeclaration("a");
    NetDeclaration b = new NetDeclaration("b");
    md.getItems().add(a);
    Assertions.assertSame(md, a.getParent());
    md.getItems().set(0, b);
    Assertions.assertNull(a.getParent());
    Assertions.assertSame(md, b.getParent());
    md.getItems().add(a);
    md.getItems().purgeTo(1);
    Assertions.assertNull(a.getParent());
    Assertions.assertEquals(List.of(b), new ArrayList<>(md.getItems()));
  }

  @Test
  void testCloneIsDeepAndDropsCaches() {
    ParameterDeclaration p = new ParameterDeclaration("P", new Number(1));
    ModuleDeclaration md = new ModuleDeclaration("M", List.of(), List.of(p));
    p.setCache(String.class, "cached");
    ModuleDeclaration copy = md.clone();

    ParameterDeclaration q = (ParameterDeclaration)copy.getItems().get(0);
    Assertions.assertNotSame(p, q);
    Assertions.assertSame(copy, q.getParent());
    Assertions.assertNull(copy.getParent());
    Assertions.assertTrue(q.getCache(String.class).isEmpty());
    Assertions.assertEquals("cached", p.getCache(String.class).get());
  }

  @Test
  void testLiveChildrenOfExpandedConstruct() {
    GenerateBlock then = new GenerateBlock(new Identifier("t"), List.of(new NetDeclaration("x")));
    IfGenerateConstruct igc = new IfGenerateConstruct(new Number(1), then, null);
    Assertions.assertTrue(igc.liveChildren().contains(then));

    GenerateBlock expanded = then.clone();
    igc.setGenerated(List.of(expanded));
    Assertions.assertTrue(igc.isElaborated());
    Assertions.assertFalse(igc.liveChildren().contains(then));
    Assertions.assertTrue(igc.liveChildren().contains(expanded));
    Assertions.assertSame(igc, expanded.getParent());

    List<Node> walked = new ArrayList<>();
    igc.walk(walked::add);
    Assertions.assertEquals(4, walked.size());
  }

  @Test
  void testFindAncestor() {
    NetDeclaration x = new NetDeclaration("x");
    GenerateBlock block = new GenerateBlock(List.of(x));
    ModuleDeclaration md = new ModuleDeclaration("M", List.of(), List.of(block));
    Assertions.assertSame(md, x.findAncestor(ModuleDeclaration.class).get());
    Assertions.assertSame(block, x.findAncestor(GenerateBlock.class).get());
    Assertions.assertTrue(md.findAncestor(ModuleDeclaration.class).isEmpty());
  }
}
