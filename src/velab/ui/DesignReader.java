package velab.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import velab.ast.ArgAssign;
import velab.ast.AttrSpec;
import velab.ast.Attributes;
import velab.ast.CaseGenerateConstruct;
import velab.ast.CaseGenerateItem;
import velab.ast.ContinuousAssign;
import velab.ast.Expression;
import velab.ast.GenerateBlock;
import velab.ast.GenvarDeclaration;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.IfGenerateConstruct;
import velab.ast.IntegerDeclaration;
import velab.ast.LocalparamDeclaration;
import velab.ast.LoopGenerateConstruct;
import velab.ast.ModuleDeclaration;
import velab.ast.ModuleInstantiation;
import velab.ast.ModuleItem;
import velab.ast.NetDeclaration;
import velab.ast.Number;
import velab.ast.ParameterDeclaration;
import velab.ast.PortDeclaration;
import velab.ast.PortDeclaration.Direction;
import velab.ast.RegDeclaration;

/**
 * Reads a design description from YAML.
 *
 * <pre>
 * modules:
 *   - module: Root
 *     attributes: {__target: "sw"}
 *   - module: Leaf
 *     ports: [{name: clk, dir: input}, {name: q, dir: output, reg: true}]
 *     items:
 *       - parameter: {name: N, value: 4}
 *       - genvar: i
 *       - for: {genvar: i, init: 0, cond: i &lt; N, update: i + 1, body: {name: blk, items: [{wire: w}]}}
 * eval:
 *   - wire: clk
 *   - instance: {module: Leaf, name: leaf, params: {N: 2}, ports: [clk]}
 * </pre>
 *
 * The first module is the root of the design. A module may only instantiate modules declared before it,
 * so the hierarchy below the root is usually built by the eval items.
 * Expressions are YAML integers or strings in the syntax of {@link ExpressionReader}.
 */
public class DesignReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Module declarations in file order, and the items to evaluate into the root instance afterwards. */
  public record Design(List<ModuleDeclaration> modules, List<ModuleItem> eval) {}

  public static Design read(File file) throws DesignFormatException {
    try (InputStream in = new FileInputStream(file)) {
      return read(new Yaml().load(in), file.getName());
    } catch (IOException e) {
      throw new DesignFormatException("Cannot read design " + file, e);
    } catch (YAMLException e) {
      throw new DesignFormatException("Malformed design " + file + ": " + e.getMessage(), e);
    }
  }

  public static Design read(String yaml) throws DesignFormatException {
    try {
      return read(new Yaml().load(new StringReader(yaml)), "<string>");
    } catch (YAMLException e) {
      throw new DesignFormatException("Malformed design: " + e.getMessage(), e);
    }
  }

  private static Design read(Object root, String source) throws DesignFormatException {
    Map<?, ?> top = asMap(root, "design");
    List<ModuleDeclaration> modules = new ArrayList<>();
    for (Object module : asList(top.get("modules"), "modules"))
      modules.add(readModule(asMap(module, "module")));
    if (modules.isEmpty())
      throw new DesignFormatException("Design " + source + " declares no modules");
    List<ModuleItem> eval = new ArrayList<>();
    if (top.containsKey("eval")) {
      for (Object item : asList(top.get("eval"), "eval"))
        eval.add(readItem(item));
    }
    logger.debug("Read {} module(s) and {} item(s) to evaluate from {}", modules.size(), eval.size(), source);
    return new Design(modules, eval);
  }

  private static ModuleDeclaration readModule(Map<?, ?> module) throws DesignFormatException {
    Identifier id = identifier(module.get("module"), "module name");
    String name = id.readable();
    List<PortDeclaration> ports = new ArrayList<>();
    if (module.containsKey("ports")) {
      for (Object port : asList(module.get("ports"), "ports of " + name))
        ports.add(readPort(asMap(port, "port of " + name)));
    }
    return new ModuleDeclaration(readAttributes(module.get("attributes")), id, ports,
                                 readItems(module.get("items"), "items of " + name));
  }

  private static PortDeclaration readPort(Map<?, ?> port) throws DesignFormatException {
    Identifier id = identifier(port.get("name"), "port name");
    String name = id.readable();
    Direction dir;
    switch (asString(port.get("dir"), "direction of port " + name)) {
    case "input":
      dir = Direction.INPUT;
      break;
    case "output":
      dir = Direction.OUTPUT;
      break;
    case "inout":
      dir = Direction.INOUT;
      break;
    default:
      throw new DesignFormatException("Unknown direction of port " + name + ": " + port.get("dir"));
    }
    boolean reg = Boolean.TRUE.equals(port.get("reg"));
    return new PortDeclaration(dir, id, reg);
  }

  private static Attributes readAttributes(Object attrs) throws DesignFormatException {
    Attributes ret = new Attributes();
    if (attrs == null)
      return ret;
    for (Map.Entry<?, ?> entry : asMap(attrs, "attributes").entrySet()) {
      Expression value = (entry.getValue() == null) ? null : readExpression(entry.getValue());
      ret.getAs().add(new AttrSpec(identifier(entry.getKey(), "attribute name"), value));
    }
    return ret;
  }

  private static List<ModuleItem> readItems(Object items, String what) throws DesignFormatException {
    List<ModuleItem> ret = new ArrayList<>();
    if (items == null)
      return ret;
    for (Object item : asList(items, what))
      ret.add(readItem(item));
    return ret;
  }

  /** Reads one item: a map with exactly one key naming the item kind. */
  public static ModuleItem readItem(Object item) throws DesignFormatException {
    Map<?, ?> map = asMap(item, "item");
    if (map.size() != 1)
      throw new DesignFormatException("An item must have exactly one key, got " + map.keySet());
    Map.Entry<?, ?> entry = map.entrySet().iterator().next();
    String kind = entry.getKey().toString();
    Object body = entry.getValue();
    switch (kind) {
    case "parameter":
      return new ParameterDeclaration(declName(body, kind), declValue(body));
    case "localparam":
      return new LocalparamDeclaration(declName(body, kind), declValue(body));
    case "integer":
      return new IntegerDeclaration(declName(body, kind), declValue(body));
    case "wire":
      return new NetDeclaration(declName(body, kind), declValue(body));
    case "reg":
      return new RegDeclaration(declName(body, kind), declValue(body));
    case "genvar":
      return new GenvarDeclaration(declName(body, kind));
    case "assign": {
      Map<?, ?> assign = asMap(body, kind);
      Expression lhs = readExpression(assign.get("lhs"));
      if (!(lhs instanceof IdentifierRef))
        throw new DesignFormatException("The target of an assignment must be a name, got " + assign.get("lhs"));
      return new ContinuousAssign((IdentifierRef)lhs, readExpression(assign.get("rhs")));
    }
    case "instance":
      return readInstance(asMap(body, kind));
    case "if": {
      Map<?, ?> igc = asMap(body, kind);
      GenerateBlock elseBlock = igc.containsKey("else") ? readBlock(igc.get("else")) : null;
      return new IfGenerateConstruct(readExpression(igc.get("cond")), readBlock(igc.get("then")), elseBlock);
    }
    case "case":
      return readCase(asMap(body, kind));
    case "for": {
      Map<?, ?> lgc = asMap(body, kind);
      return new LoopGenerateConstruct(new IdentifierRef(path(lgc.get("genvar"), "genvar")), readExpression(lgc.get("init")),
                                       readExpression(lgc.get("cond")), readExpression(lgc.get("update")),
                                       readBlock(lgc.get("body")));
    }
    case "block":
      return readBlock(body);
    default:
      throw new DesignFormatException("Unknown item kind " + kind);
    }
  }

  private static Identifier declName(Object body, String kind) throws DesignFormatException {
    if (body instanceof Map)
      return identifier(((Map<?, ?>)body).get("name"), kind + " name");
    return identifier(body, kind + " name");
  }

  private static Expression declValue(Object body) throws DesignFormatException {
    if (body instanceof Map && ((Map<?, ?>)body).get("value") != null)
      return readExpression(((Map<?, ?>)body).get("value"));
    return null;
  }

  private static ModuleInstantiation readInstance(Map<?, ?> inst) throws DesignFormatException {
    Identifier module = identifier(inst.get("module"), "instantiated module");
    Identifier name = identifier(inst.get("name"), "instance name of " + module.readable());
    return new ModuleInstantiation(readAttributes(inst.get("attributes")), module, name,
                                   readArgs(inst.get("params")), readArgs(inst.get("ports")));
  }

  // A map gives named connections, a list ordered ones.
  private static List<ArgAssign> readArgs(Object args) throws DesignFormatException {
    List<ArgAssign> ret = new ArrayList<>();
    if (args == null)
      return ret;
    if (args instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>)args).entrySet()) {
        Expression value = (entry.getValue() == null) ? null : readExpression(entry.getValue());
        ret.add(new ArgAssign(identifier(entry.getKey(), "connection name"), value));
      }
      return ret;
    }
    for (Object arg : asList(args, "connections"))
      ret.add(new ArgAssign(readExpression(arg)));
    return ret;
  }

  private static CaseGenerateConstruct readCase(Map<?, ?> cgc) throws DesignFormatException {
    List<CaseGenerateItem> items = new ArrayList<>();
    for (Object obj : asList(cgc.get("items"), "case items")) {
      Map<?, ?> item = asMap(obj, "case item");
      if (item.containsKey("default")) {
        items.add(new CaseGenerateItem(List.of(), readBlock(item.get("default"))));
        continue;
      }
      List<Expression> values = new ArrayList<>();
      for (Object value : asList(item.get("values"), "case item values"))
        values.add(readExpression(value));
      items.add(new CaseGenerateItem(values, readBlock(item.get("block"))));
    }
    return new CaseGenerateConstruct(readExpression(cgc.get("selector")), items);
  }

  // Either a map with an optional name and items, or a plain item list for an unnamed block.
  private static GenerateBlock readBlock(Object block) throws DesignFormatException {
    if (block instanceof List)
      return new GenerateBlock(readItems(block, "block items"));
    Map<?, ?> map = asMap(block, "generate block");
    Identifier id = map.containsKey("name") ? path(map.get("name"), "block name") : null;
    return new GenerateBlock(id, readItems(map.get("items"), "block items"));
  }

  private static Expression readExpression(Object value) throws DesignFormatException {
    if (value instanceof Integer || value instanceof Long)
      return new Number(((java.lang.Number)value).longValue());
    if (value instanceof Boolean)
      return new Number(((Boolean)value) ? 1 : 0);
    if (value instanceof String)
      return ExpressionReader.parse((String)value);
    throw new DesignFormatException("Expected an expression, got " + value);
  }

  // A single segment: module, instance, port, declaration, attribute and connection names.
  private static Identifier identifier(Object value, String what) throws DesignFormatException {
    String name = asString(value, what);
    try {
      return new Identifier(name);
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException("Invalid " + what + " '" + name + "': " + e.getMessage(), e);
    }
  }

  private static Identifier path(Object value, String what) throws DesignFormatException {
    String readable = asString(value, what);
    try {
      return Identifier.parse(readable);
    } catch (IllegalArgumentException e) {
      throw new DesignFormatException("Invalid " + what + " '" + readable + "': " + e.getMessage(), e);
    }
  }

  private static Map<?, ?> asMap(Object value, String what) throws DesignFormatException {
    if (!(value instanceof Map))
      throw new DesignFormatException("Expected a map for " + what + ", got " + value);
    return (Map<?, ?>)value;
  }

  private static List<?> asList(Object value, String what) throws DesignFormatException {
    if (!(value instanceof List))
      throw new DesignFormatException("Expected a list for " + what + ", got " + value);
    return (List<?>)value;
  }

  private static String asString(Object value, String what) throws DesignFormatException {
    if (value == null)
      throw new DesignFormatException("Missing " + what);
    return value.toString();
  }
}
