package velab.program;

import static velab.program.TestModules.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import velab.analyze.ModuleInfo;
import velab.ast.ArgAssign;
import velab.ast.AttrSpec;
import velab.ast.Attributes;
import velab.ast.BinaryExpression;
import velab.ast.CaseGenerateConstruct;
import velab.ast.CaseGenerateItem;
import velab.ast.ContinuousAssign;
import velab.ast.GenerateBlock;
import velab.ast.GenvarDeclaration;
import velab.ast.Identifier;
import velab.ast.IfGenerateConstruct;
import velab.ast.LocalparamDeclaration;
import velab.ast.LoopGenerateConstruct;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.NetDeclaration;
import velab.ast.ParameterDeclaration;
import velab.ast.RegDeclaration;
import velab.ast.StringLiteral;
import velab.ui.ElabConfig;
import velab.util.ErrorKind;

class ProgramTest {
  Program program;

  @BeforeEach
  void setUp() {
    program = new Program(module("Root"));
    Assertions.assertFalse(program.error());
  }

  static Set<String> elabNames(Program program) {
    return program.getElabs().keySet().stream().map(Identifier::readable).collect(Collectors.toSet());
  }

  ModuleDeclaration root() { return program.src().get(); }

  @Test
  void testRootInstantiation() {
    Assertions.assertEquals(Set.of("root"), elabNames(program));
    Assertions.assertEquals(new Identifier("Root"), program.rootDecl().get().getId());
    Assertions.assertEquals(new Identifier("root"), program.getRootInstantiation().get().getIid());
    Assertions.assertSame(program.getRootInstantiation().get(), root().getParent());
  }

  @Test
  void testEvalInstance() {
    program.declare(module("Leaf", new NetDeclaration("w")));
    Assertions.assertFalse(program.error());
    program.eval(inst("Leaf", "l"));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    Assertions.assertEquals(Set.of("root", "root.l"), elabNames(program));
    ModuleDeclaration leaf = program.elabFind(Identifier.parse("root.l")).get();
    Assertions.assertNotSame(program.declFind(new Identifier("Leaf")).get(), leaf);
    Assertions.assertEquals(1, leaf.getItems().size());
  }

  @Test
  void testDuplicateDeclaration() {
    program.declare(module("Leaf"));
    program.declare(module("Leaf", new NetDeclaration("w")));
    Assertions.assertTrue(program.error(ErrorKind.DuplicateDeclaration));
    Assertions.assertEquals(2, program.getDecls().size());
    Assertions.assertTrue(program.declFind(new Identifier("Leaf")).get().getItems().isEmpty());
  }

  @Test
  void testDiagnosticsClearedPerOperation() {
    program.declare(module("Root"));
    Assertions.assertTrue(program.error());
    program.declare(module("Leaf"));
    Assertions.assertFalse(program.error());
  }

  @Test
  void testMissingRootDeclaration() {
    Program empty = new Program();
    empty.eval(new NetDeclaration("w"));
    Assertions.assertTrue(empty.error(ErrorKind.MissingRootDeclaration));

    empty.declare(module("Top"));
    empty.declare(module("Leaf"));
    empty.eval(inst("Leaf", "l"));
    Assertions.assertTrue(empty.error(ErrorKind.MissingRootDeclaration));
    empty.eval(new NetDeclaration("w"));
    Assertions.assertTrue(empty.error(ErrorKind.MissingRootDeclaration));
    Assertions.assertTrue(empty.getElabs().isEmpty());
    Assertions.assertTrue(empty.src().isEmpty());

    empty.eval(inst("Top", "top"));
    Assertions.assertFalse(empty.error());
    Assertions.assertEquals(Set.of("top"), elabNames(empty));
  }

  @Test
  void testUndeclaredModuleRejected() {
    int items = root().getItems().size();
    program.eval(inst("Nope", "x"));
    Assertions.assertTrue(program.error());
    Assertions.assertTrue(program.getErrors().get(0).message().contains("Nope"));
    Assertions.assertEquals(items, root().getItems().size());
    Assertions.assertEquals(Set.of("root"), elabNames(program));
  }

  @Test
  void testFailedEvalIsAtomic() {
    program.declare(module("Leaf"));
    program.eval(inst("Leaf", "l"));
    Assertions.assertFalse(program.error());
    Set<Identifier> childrenBefore = Set.copyOf(new ModuleInfo(root()).children().keySet());
    int items = root().getItems().size();

    // a is elaborated before b fails
    ModuleInstantiation a = inst("Leaf", "a");
    program.eval(block(null, a, inst("Nope", "b")));
    Assertions.assertTrue(program.error());

    Assertions.assertEquals(Set.of("root", "root.l"), elabNames(program));
    Assertions.assertFalse(a.isElaborated());
    Assertions.assertEquals(items, root().getItems().size());
    Assertions.assertEquals(childrenBefore, new ModuleInfo(root()).children().keySet());

    // The rejected names are free again.
    program.eval(inst("Leaf", "a"));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    Assertions.assertEquals(Set.of("root", "root.l", "root.a"), elabNames(program));
  }

  @Test
  void testDuplicateInstanceName() {
    program.declare(module("Leaf"));
    program.eval(inst("Leaf", "l"));
    program.eval(inst("Leaf", "l"));
    Assertions.assertTrue(program.error());
    Assertions.assertEquals(Set.of("root", "root.l"), elabNames(program));
    Assertions.assertEquals(1, root().getItems().size());
  }

  @Test
  void testDuplicateInstanceNameWithoutTypecheck() {
    program.typecheck(false);
    program.declare(module("Leaf"));
    program.eval(inst("Leaf", "l"));
    ModuleInstantiation again = inst("Leaf", "l");
    program.eval(again);
    Assertions.assertTrue(program.error());
    Assertions.assertFalse(again.isElaborated());
    Assertions.assertEquals(Set.of("root", "root.l"), elabNames(program));
  }

  @Test
  void testTypecheckOffStillReportsMissingModule() {
    program.typecheck(false);
    program.eval(inst("Nope", "x"));
    Assertions.assertTrue(program.error());
  }

  @Test
  void testLoopGenerateInstances() {
    program.declare(module("Leaf"));
    program.declare(loopModule("Mid", 3, inst("Leaf", "u")));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    program.eval(inst("Mid", "m"));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    Assertions.assertEquals(Set.of("root", "root.m", "root.m.g[0].u", "root.m.g[1].u", "root.m.g[2].u"), elabNames(program));

    ModuleDeclaration mid = program.elabFind(Identifier.parse("root.m")).get();
    LoopGenerateConstruct loop = (LoopGenerateConstruct)mid.getItems().get(2);
    List<GenerateBlock> blocks = loop.getGenerated();
    Assertions.assertEquals(3, blocks.size());
    for (int i = 0; i < 3; ++i) {
      Assertions.assertEquals(new Identifier(new Identifier.Id("g", i)), blocks.get(i).getId().get());
      LocalparamDeclaration genvar = (LocalparamDeclaration)blocks.get(i).getItems().get(0);
      Assertions.assertEquals(new Identifier("i"), genvar.getId());
    }
    // the template is not touched
    Assertions.assertEquals(1, loop.getBody().getItems().size());
    Assertions.assertEquals(3, new ModuleInfo(mid).children().size());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 4})
  void testParameterOverrideChangesExpansion(int n) {
    program.declare(module("Leaf"));
    program.declare(loopModule("Mid", 3, inst("Leaf", "u")));
    program.eval(inst("Mid", "ordered", n));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    program.eval(instNamed("Mid", "named", List.of(named("N", num(n))), List.of()));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    // root, two Mids, n Leafs each
    Assertions.assertEquals(3 + 2 * n, program.getElabs().size());
    Assertions.assertTrue(program.elabFind(Identifier.parse("root.named.g[0].u")).isPresent() == (n > 0));
  }

  @Test
  void testOverrideFromEnclosingScope() {
    program.declare(loopModule("Mid", 1, new NetDeclaration("w")));
    program.eval(new LocalparamDeclaration("K", num(2)));
    program.eval(instNamed("Mid", "m", List.of(named("N", bin(ref("K"), BinaryExpression.Op.TIMES, num(3)))), List.of()));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    ModuleDeclaration mid = program.elabFind(Identifier.parse("root.m")).get();
    Assertions.assertEquals(6, ((LoopGenerateConstruct)mid.getItems().get(2)).getGenerated().size());
  }

  @Test
  void testBadOverrides() {
    program.declare(loopModule("Mid", 1));
    program.eval(instNamed("Mid", "m1", List.of(named("M", num(1))), List.of()));
    Assertions.assertTrue(program.error());
    program.eval(inst("Mid", "m2", 1, 2));
    Assertions.assertTrue(program.error());
    program.eval(instNamed("Mid", "m3", List.of(named("N", num(1)), new ArgAssign(num(2))), List.of()));
    Assertions.assertTrue(program.error());
    program.eval(new NetDeclaration("w"));
    program.eval(instNamed("Mid", "m4", List.of(named("N", ref("w"))), List.of()));
    Assertions.assertTrue(program.error());
    Assertions.assertEquals(Set.of("root"), elabNames(program));
  }

  @Test
  void testIfGenerateAndHierarchicalReference() {
    program.eval(new LocalparamDeclaration("P", num(1)));
    program.eval(new IfGenerateConstruct(ref("P"), block("t", new NetDeclaration("z")), block("f", new NetDeclaration("y"))));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    IfGenerateConstruct igc = (IfGenerateConstruct)root().getItems().get(1);
    Assertions.assertEquals(new Identifier("t"), igc.getGenerated().get(0).getId().get());

    program.eval(new ContinuousAssign(ref("t.z"), num(1)));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    program.eval(new ContinuousAssign(ref("f.y"), num(1)));
    Assertions.assertTrue(program.error());
  }

  @Test
  void testCaseGenerate() {
    ModuleDeclaration sel =
        module("Sel", new ParameterDeclaration("S", num(0)),
               new CaseGenerateConstruct(ref("S"), List.of(new CaseGenerateItem(List.of(num(1), num(2)), block("a", new NetDeclaration("x"))),
                                                           new CaseGenerateItem(List.of(), block("d", new NetDeclaration("x"))))));
    program.declare(sel);
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
    program.eval(inst("Sel", "s2", 2));
    program.eval(inst("Sel", "s7", 7));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());

    CaseGenerateConstruct s2 = (CaseGenerateConstruct)program.elabFind(Identifier.parse("root.s2")).get().getItems().get(1);
    CaseGenerateConstruct s7 = (CaseGenerateConstruct)program.elabFind(Identifier.parse("root.s7")).get().getItems().get(1);
    Assertions.assertEquals(new Identifier("a"), s2.getGenerated().get(0).getId().get());
    Assertions.assertEquals(new Identifier("d"), s7.getGenerated().get(0).getId().get());
  }

  @Test
  void testNonConstantCondition() {
    program.eval(new NetDeclaration("w"));
    program.eval(new IfGenerateConstruct(ref("w"), block("t"), null));
    Assertions.assertTrue(program.error());
    Assertions.assertEquals(1, root().getItems().size());
  }

  @Test
  void testLoopOverNonGenvar() {
    program.eval(new NetDeclaration("w"));
    program.eval(new LoopGenerateConstruct(ref("w"), num(0), bin(ref("w"), BinaryExpression.Op.LT, num(2)),
                                           bin(ref("w"), BinaryExpression.Op.PLUS, num(1)), block("g")));
    Assertions.assertTrue(program.error());
  }

  @Test
  void testRunawayLoopReported() {
    ElabConfig config = new ElabConfig();
    config.max_loop_iterations = 16;
    program.configure(config);
    program.eval(new GenvarDeclaration("i"));
    // i = i never terminates
    program.eval(new LoopGenerateConstruct(ref("i"), num(0), bin(ref("i"), BinaryExpression.Op.LT, num(1)), ref("i"), block("g")));
    Assertions.assertTrue(program.error(ErrorKind.SemanticError));
    Assertions.assertEquals(1, root().getItems().size());
  }

  @Test
  void testDeclareWarnsEvaluateFails() {
    ModuleDeclaration leaf = module("Leaf", new NetDeclaration("w"), new ContinuousAssign(ref("w"), ref("x")));
    program.declare(leaf);
    Assertions.assertFalse(program.error());
    Assertions.assertTrue(program.warning());
    Assertions.assertTrue(program.getWarnings().get(0).message().contains("x"));

    program.eval(inst("Leaf", "l"));
    Assertions.assertTrue(program.error());
    Assertions.assertEquals(Set.of("root"), elabNames(program));
  }

  @Test
  void testAssignToReg() {
    program.eval(new RegDeclaration("r"));
    program.eval(new ContinuousAssign(ref("r"), num(1)));
    Assertions.assertTrue(program.error());
    program.eval(new NetDeclaration("w"));
    program.eval(new ContinuousAssign(ref("w"), ref("r")));
    Assertions.assertFalse(program.error(), () -> program.getErrors().toString());
  }

  @Test
  void testDuplicateDeclarationInScope() {
    program.eval(new NetDeclaration("w"));
    program.eval(new RegDeclaration("w"));
    Assertions.assertTrue(program.error());
    Assertions.assertEquals(1, root().getItems().size());
  }

  @Test
  void testAttributePropagation() {
    Program prog = new Program(module(new Attributes(List.of(new AttrSpec("__target", new StringLiteral("sw")))), "Top"));
    prog.declare(module("Leaf"));
    Assertions.assertTrue(prog.declFind(new Identifier("Leaf")).get().getAttrs().has("__target"));
    prog.declare(module(attrs("__std"), "Own"));
    Assertions.assertFalse(prog.declFind(new Identifier("Own")).get().getAttrs().has("__target"));

    ModuleInstantiation mi = inst("Own", "o");
    mi.getAttrs().getAs().add(new AttrSpec("__loc"));
    prog.eval(mi);
    Assertions.assertFalse(prog.error(), () -> prog.getErrors().toString());
    Attributes instAttrs = prog.elabFind(Identifier.parse("top.o")).get().getAttrs();
    Assertions.assertTrue(instAttrs.has("__std"));
    Assertions.assertTrue(instAttrs.has("__loc"));
  }

  @Test
  void testConstructorWithInstantiation() {
    Program prog = new Program(module("Top"), inst("Top", "main"));
    Assertions.assertFalse(prog.error());
    Assertions.assertEquals(Set.of("main"), elabNames(prog));
  }
}
