package velab.analyze;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import velab.ast.GenerateBlock;
import velab.ast.Identifier;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.ModuleItem;
import velab.ast.NetDeclaration;
import velab.ast.PortDeclaration;
import velab.ast.PortDeclaration.Direction;

class ModuleInfoTest {
  @Test
  void testPortsAndChildren() {
    ModuleInstantiation u = new ModuleInstantiation("Leaf", "u");
    ModuleInstantiation v = new ModuleInstantiation("Leaf", "v");
    ModuleInstantiation w = new ModuleInstantiation("Leaf", "w");
    ModuleDeclaration md = new ModuleDeclaration(
        "M",
        List.of(new PortDeclaration(Direction.INPUT, "i"), new PortDeclaration(Direction.OUTPUT, "o"),
                new PortDeclaration(Direction.INOUT, "io")),
        List.<ModuleItem>of(u, new GenerateBlock(new Identifier("b"), List.of(v)), new GenerateBlock(List.of(w)), new NetDeclaration("n")));

    ModuleInfo info = new ModuleInfo(md);
    Assertions.assertEquals(List.of(new Identifier("i"), new Identifier("io")), info.inputs().stream().map(port -> port.getId()).toList());
    Assertions.assertEquals(List.of(new Identifier("o"), new Identifier("io")), info.outputs().stream().map(port -> port.getId()).toList());
    Assertions.assertEquals(List.of(Identifier.parse("u"), Identifier.parse("b.v"), Identifier.parse("w")), List.copyOf(info.children().keySet()));
    Assertions.assertSame(v, info.children().get(Identifier.parse("b.v")));
  }

  @Test
  void testCachedUntilInvalidated() {
    ModuleDeclaration md = new ModuleDeclaration("M", List.of(), List.of(new ModuleInstantiation("Leaf", "u")));
    Assertions.assertEquals(1, new ModuleInfo(md).children().size());
    md.getItems().add(new ModuleInstantiation("Leaf", "x"));
    Assertions.assertEquals(1, new ModuleInfo(md).children().size());
    new ModuleInfo(md).invalidate();
    Assertions.assertEquals(2, new ModuleInfo(md).children().size());
  }
}
