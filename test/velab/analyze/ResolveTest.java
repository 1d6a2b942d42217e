package velab.analyze;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import velab.ast.ContinuousAssign;
import velab.ast.GenerateBlock;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleItem;
import velab.ast.NetDeclaration;

class ResolveTest {
  NetDeclaration a, c, d;
  GenerateBlock b, unnamed;
  ContinuousAssign inner, outer;
  ModuleDeclaration md;

  // module M; wire a; begin : b wire c; begin wire d; end assign c = a; end assign b.c = a; endmodule
  @BeforeEach
  void setUp() {
    a = new NetDeclaration("a");
    c = new NetDeclaration("c");
    d = new NetDeclaration("d");
    unnamed = new GenerateBlock(List.of(d));
    inner = new ContinuousAssign(new IdentifierRef("c"), new IdentifierRef("a"));
    b = new GenerateBlock(new Identifier("b"), List.of(c, unnamed, inner));
    outer = new ContinuousAssign(new IdentifierRef("b.c"), new IdentifierRef("a"));
    md = new ModuleDeclaration("M", List.of(), List.<ModuleItem>of(a, b, outer));
  }

  @Test
  void testNavigateScopes() {
    Navigate top = new Navigate(md);
    Assertions.assertSame(a, top.find(new Identifier.Id("a")).get());
    Assertions.assertSame(b, top.find(new Identifier.Id("b")).get());
    Assertions.assertTrue(top.find(new Identifier.Id("c")).isEmpty());
    Assertions.assertEquals(Set.of(new Identifier.Id("a"), new Identifier.Id("b")), top.getNames());
    Assertions.assertTrue(top.up().isEmpty());

    Navigate inBlock = new Navigate(c);
    Assertions.assertSame(b, inBlock.getScope().get());
    // names of unnamed blocks are visible in the enclosing scope
    Assertions.assertSame(d, inBlock.find(new Identifier.Id("d")).get());
    Assertions.assertSame(md, inBlock.up().get().getScope().get());
  }

  @Test
  void testNavigateCount() {
    unnamed.getItems().add(new NetDeclaration("c"));
    Navigate nav = new Navigate(b);
    Assertions.assertEquals(2, nav.count(new Identifier.Id("c")));
    Assertions.assertEquals(0, nav.count(new Identifier.Id("x")));
  }

  @Test
  void testLostNode() {
    Navigate nav = new Navigate(new IdentifierRef("x"));
    Assertions.assertTrue(nav.lost());
    Assertions.assertTrue(nav.find(new Identifier.Id("x")).isEmpty());
  }

  @Test
  void testResolveThroughEnclosingScopes() {
    Resolve resolve = new Resolve();
    Assertions.assertSame(a, resolve.getResolution((IdentifierRef)inner.getRhs()).get());
    Assertions.assertSame(c, resolve.getResolution(inner.getLhs()).get());
  }

  @Test
  void testHierarchicalReference() {
    Assertions.assertSame(c, new Resolve().getResolution(outer.getLhs()).get());
    // a local-only resolver does not follow b into its scope
    ContinuousAssign other = new ContinuousAssign(new IdentifierRef("b.c"), new IdentifierRef("a"));
    md.getItems().add(other);
    Assertions.assertTrue(new Resolve(true).getResolution(other.getLhs()).isEmpty());
    Assertions.assertSame(a, new Resolve(true).getResolution((IdentifierRef)other.getRhs()).get());
  }

  @Test
  void testUnresolved() {
    ContinuousAssign bad = new ContinuousAssign(new IdentifierRef("b.x"), new IdentifierRef("nope"));
    md.getItems().add(bad);
    Resolve resolve = new Resolve();
    Assertions.assertTrue(resolve.getResolution(bad.getLhs()).isEmpty());
    Assertions.assertTrue(resolve.getResolution((IdentifierRef)bad.getRhs()).isEmpty());
  }

  @Test
  void testFullId() {
    Resolve resolve = new Resolve();
    Assertions.assertEquals(Identifier.parse("b.c"), resolve.getFullId(c));
    Assertions.assertEquals(Identifier.parse("b.d"), resolve.getFullId(d));
    Assertions.assertEquals(Identifier.parse("a"), resolve.getFullId(a));
    Assertions.assertEquals(new Identifier("M"), resolve.getFullId(md));
  }

  @Test
  void testInvalidateDropsStaleResolutions() {
    Resolve resolve = new Resolve();
    IdentifierRef ref = (IdentifierRef)outer.getRhs();
    Assertions.assertSame(a, resolve.getResolution(ref).get());

    md.getItems().remove(a);
    new Navigate(md).invalidate();
    // still cached
    Assertions.assertSame(a, resolve.getResolution(ref).get());

    resolve.invalidate(a);
    Assertions.assertTrue(resolve.getResolution(ref).isEmpty());
  }
}
