package fsmgen.frontend;

import fsmgen.ir.Assignment;
import fsmgen.ir.Attr;
import fsmgen.ir.Attributes;
import fsmgen.ir.Builder;
import fsmgen.ir.Cell;
import fsmgen.ir.Component;
import fsmgen.ir.Control;
import fsmgen.ir.Group;
import fsmgen.ir.Guard;
import fsmgen.ir.Library;
import fsmgen.ir.MalformedControlException;
import fsmgen.ir.PortComp;
import fsmgen.ir.Primitive;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a component description from YAML.
 * <p>
 * Example:
 * <pre>
 * name: main
 * cells:
 *   - {name: r, prototype: std_reg, params: {WIDTH: 32}}
 * groups:
 *   - name: write_r
 *     static: 1
 *     assignments:
 *       - {dst: r.in, src: "const(5,32)"}
 *       - {dst: r.write_en, src: "const(1,1)"}
 *       - {dst: "write_r[done]", src: r.done}
 * control:
 *   seq:
 *     - enable: write_r
 * </pre>
 * Control nodes are maps with exactly one statement key and optionally the attribute keys {@code static},
 * {@code bound}, {@code promotable} and {@code pos}.
 */
public class ComponentReader {
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern constPattern = Pattern.compile("const\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");
  private static final Pattern holePattern = Pattern.compile("([A-Za-z_][\\w]*)\\[(go|done)\\]");
  private static final Set<String> attrKeys = Set.of("static", "bound", "promotable", "pos");
  private static final Map<String, PortComp> compOps =
      Map.of("eq", PortComp.Eq, "neq", PortComp.Neq, "lt", PortComp.Lt, "le", PortComp.Leq, "gt", PortComp.Gt, "ge", PortComp.Geq);

  private final Library library;

  public ComponentReader(Library library) { this.library = library; }

  /**
   * Reads a component description file.
   * @throws MalformedControlException if the file cannot be read or does not describe a valid component
   */
  public Component read(File file) throws MalformedControlException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    } catch (IOException e) {
      throw new MalformedControlException("Cannot read component description " + file.getPath(), e);
    }
  }

  public Component read(InputStream in) throws MalformedControlException {
    Object doc;
    try {
      doc = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
    } catch (YAMLException e) {
      throw new MalformedControlException("Invalid YAML in component description", e);
    }
    return fromDocument(doc);
  }

  /** Builds a component from an already parsed YAML document. */
  public Component fromDocument(Object doc) throws MalformedControlException {
    Map<String, Object> top = asMap(doc, "component");
    String name = asString(top.get("name"), "component name");
    Component comp = new Component(name);
    Builder builder = new Builder(comp, library);

    for (Object cellObj : asList(top.getOrDefault("cells", List.of()), "cells"))
      readCell(builder, asMap(cellObj, "cell"));

    // Declare all groups first: assignments and guards may refer to holes of later groups.
    List<Map<String, Object>> groupDescs = new ArrayList<>();
    for (Object groupObj : asList(top.getOrDefault("groups", List.of()), "groups")) {
      Map<String, Object> groupDesc = asMap(groupObj, "group");
      String groupName = asString(groupDesc.get("name"), "group name");
      if (comp.findCell(groupName).isPresent() || comp.findGroup(groupName).isPresent())
        throw new MalformedControlException("Duplicate name " + groupName + " in component " + name);
      Group group = comp.addGroup(groupName, asBoolean(groupDesc.getOrDefault("comb", false), "comb"));
      if (groupDesc.containsKey("static"))
        group.getAttributes().insert(Attr.Static, asLong(groupDesc.get("static"), "static"));
      if (asBoolean(groupDesc.getOrDefault("promotable", false), "promotable"))
        group.getAttributes().insert(Attr.Promotable, 1);
      groupDescs.add(groupDesc);
    }
    for (Map<String, Object> groupDesc : groupDescs) {
      Group group = comp.findGroup((String)groupDesc.get("name")).get();
      for (Object assignObj : asList(groupDesc.getOrDefault("assignments", List.of()), "assignments"))
        group.assignments.add(readAssignment(builder, assignObj));
    }
    for (Object assignObj : asList(top.getOrDefault("continuous", List.of()), "continuous"))
      comp.continuousAssignments.add(readAssignment(builder, assignObj));

    Object controlObj = top.get("control");
    comp.setControl(controlObj == null ? Control.empty() : readControl(builder, controlObj));
    for (String key : top.keySet()) {
      if (!Set.of("name", "cells", "groups", "continuous", "control").contains(key))
        logger.warn("Ignoring unknown key {} in component {}", key, name);
    }
    logger.debug("Read component {} with {} cells and {} groups", name, comp.getCells().size(), comp.getGroups().size());
    return comp;
  }

  private void readCell(Builder builder, Map<String, Object> cellDesc) throws MalformedControlException {
    String cellName = asString(cellDesc.get("name"), "cell name");
    String prototype = asString(cellDesc.get("prototype"), "prototype of " + cellName);
    Optional<Primitive> prim = library.find(prototype);
    if (prim.isEmpty())
      throw new MalformedControlException("Cell " + cellName + " has unknown prototype " + prototype);
    Map<String, Object> paramDesc = asMap(cellDesc.getOrDefault("params", Map.of()), "params of " + cellName);
    LinkedHashMap<String, Long> params = new LinkedHashMap<>();
    for (String param : prim.get().getParams()) {
      if (!paramDesc.containsKey(param))
        throw new MalformedControlException("Cell " + cellName + " is missing parameter " + param);
      params.put(param, asLong(paramDesc.get(param), param));
    }
    if (builder.getComponent().findCell(cellName).isPresent())
      throw new MalformedControlException("Duplicate cell name " + cellName);
    builder.addPrimitiveNamed(cellName, prim.get(), params);
  }

  private Assignment readAssignment(Builder builder, Object assignObj) throws MalformedControlException {
    Map<String, Object> desc = asMap(assignObj, "assignment");
    int dst = readPort(builder, asString(desc.get("dst"), "assignment destination"));
    int src = readPort(builder, asString(desc.get("src"), "assignment source"));
    Guard guard = desc.containsKey("guard") ? readGuard(builder, desc.get("guard")) : Guard.TRUE;
    return builder.buildAssignment(dst, src, guard);
  }

  /** Resolves {@code cell.port}, {@code group[go|done]} or {@code const(value,width)}. */
  static int readPort(Builder builder, String desc) throws MalformedControlException {
    Component comp = builder.getComponent();
    String trimmed = desc.trim();
    Matcher constMatch = constPattern.matcher(trimmed);
    if (constMatch.matches())
      return builder.constantOut(Long.parseLong(constMatch.group(1)), Integer.parseInt(constMatch.group(2)));
    Matcher holeMatch = holePattern.matcher(trimmed);
    if (holeMatch.matches()) {
      Group group = comp.findGroup(holeMatch.group(1))
                        .orElseThrow(() -> new MalformedControlException("Unknown group in port " + desc));
      return holeMatch.group(2).equals("go") ? group.getGo() : group.getDone();
    }
    int dot = trimmed.indexOf('.');
    if (dot <= 0 || dot == trimmed.length() - 1)
      throw new MalformedControlException("Cannot parse port " + desc);
    try {
      return comp.portIndex(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    } catch (IllegalArgumentException e) {
      throw new MalformedControlException(e.getMessage());
    }
  }

  private Guard readGuard(Builder builder, Object guardObj) throws MalformedControlException {
    if (guardObj instanceof Boolean)
      return ((Boolean)guardObj) ? Guard.TRUE : Guard.never();
    if (guardObj instanceof String)
      return Guard.port(readPort(builder, (String)guardObj));
    Map<String, Object> desc = asMap(guardObj, "guard");
    if (desc.size() != 1)
      throw new MalformedControlException("Guard must have exactly one operator, got " + desc.keySet());
    Map.Entry<String, Object> entry = desc.entrySet().iterator().next();
    String op = entry.getKey();
    if (op.equals("not"))
      return readGuard(builder, entry.getValue()).not();
    List<Object> operands = asList(entry.getValue(), "operands of " + op);
    if (operands.size() != 2)
      throw new MalformedControlException("Guard operator " + op + " takes two operands");
    if (op.equals("and"))
      return readGuard(builder, operands.get(0)).and(readGuard(builder, operands.get(1)));
    if (op.equals("or"))
      return readGuard(builder, operands.get(0)).or(readGuard(builder, operands.get(1)));
    PortComp comp = compOps.get(op);
    if (comp == null)
      throw new MalformedControlException("Unknown guard operator " + op);
    return Guard.comp(comp, readPort(builder, asString(operands.get(0), "comparison operand")),
                      readPort(builder, asString(operands.get(1), "comparison operand")));
  }

  private Control readControl(Builder builder, Object controlObj) throws MalformedControlException {
    Component comp = builder.getComponent();
    Map<String, Object> desc = asMap(controlObj, "control");
    String kind = null;
    for (String key : desc.keySet()) {
      if (attrKeys.contains(key))
        continue;
      if (kind != null)
        throw new MalformedControlException("Control node has several statement keys: " + kind + ", " + key);
      kind = key;
    }
    if (kind == null)
      throw new MalformedControlException("Control node without a statement: " + desc.keySet());
    Object body = desc.get(kind);
    Attributes attrs = new Attributes();
    if (desc.containsKey("pos"))
      attrs.setPos(String.valueOf(desc.get("pos")));
    OptionalLong latency =
        desc.containsKey("static") ? OptionalLong.of(asLong(desc.get("static"), "static")) : OptionalLong.empty();

    Control con;
    switch (kind) {
    case "enable":
      con = Control.enable(findGroup(comp, body, attrs).getIndex());
      break;
    case "static_enable": {
      Group group = findGroup(comp, body, attrs);
      OptionalLong groupLatency = latency.isPresent() ? latency : group.getAttributes().get(Attr.Static);
      if (groupLatency.isEmpty())
        throw new MalformedControlException("static enable of " + group.getName() + " without a latency", attrs.getPos());
      con = Control.staticEnable(group.getIndex(), groupLatency.getAsLong());
      break;
    }
    case "invoke":
      con = readInvoke(builder, body);
      break;
    case "seq":
      con = Control.seq(readStmts(builder, body));
      break;
    case "par":
      con = Control.par(readStmts(builder, body));
      break;
    case "static_seq":
      con = Control.staticSeq(readStmts(builder, body), requireLatency(latency, kind, attrs));
      break;
    case "static_par":
      con = Control.staticPar(readStmts(builder, body), requireLatency(latency, kind, attrs));
      break;
    case "if":
    case "static_if": {
      Map<String, Object> ifDesc = asMap(body, kind);
      int port = readPort(builder, asString(ifDesc.get("port"), "if port"));
      Control tbranch = ifDesc.containsKey("then") ? readControl(builder, ifDesc.get("then")) : Control.empty();
      Control fbranch = ifDesc.containsKey("else") ? readControl(builder, ifDesc.get("else")) : Control.empty();
      if (kind.equals("static_if")) {
        if (ifDesc.containsKey("with"))
          throw new MalformedControlException("static if cannot have a combinational group", attrs.getPos());
        con = Control.staticIf(port, tbranch, fbranch, requireLatency(latency, kind, attrs));
      } else {
        con = Control.ifElse(port, readCondGroup(comp, ifDesc, attrs), tbranch, fbranch);
      }
      break;
    }
    case "while": {
      Map<String, Object> whileDesc = asMap(body, kind);
      int port = readPort(builder, asString(whileDesc.get("port"), "while port"));
      Control loopBody = whileDesc.containsKey("body") ? readControl(builder, whileDesc.get("body")) : Control.empty();
      con = Control.whileLoop(port, readCondGroup(comp, whileDesc, attrs), loopBody);
      if (whileDesc.containsKey("bound"))
        con.getAttributes().insert(Attr.Bound, asLong(whileDesc.get("bound"), "bound"));
      break;
    }
    case "repeat":
    case "static_repeat": {
      Map<String, Object> repeatDesc = asMap(body, kind);
      long count = asLong(repeatDesc.get("count"), "repeat count");
      Control loopBody = repeatDesc.containsKey("body") ? readControl(builder, repeatDesc.get("body")) : Control.empty();
      con = kind.equals("repeat") ? Control.repeat(count, loopBody)
                                  : Control.staticRepeat(count, loopBody, requireLatency(latency, kind, attrs));
      break;
    }
    case "empty":
      con = Control.empty();
      break;
    default:
      throw new MalformedControlException("Unknown control statement " + kind, attrs.getPos());
    }

    if (latency.isPresent())
      con.getAttributes().insert(Attr.Static, latency.getAsLong());
    if (desc.containsKey("bound"))
      con.getAttributes().insert(Attr.Bound, asLong(desc.get("bound"), "bound"));
    if (asBoolean(desc.getOrDefault("promotable", false), "promotable"))
      con.getAttributes().insert(Attr.Promotable, 1);
    if (attrs.getPos().isPresent())
      con.getAttributes().setPos(attrs.getPos().get());
    return con;
  }

  private List<Control> readStmts(Builder builder, Object body) throws MalformedControlException {
    List<Control> stmts = new ArrayList<>();
    for (Object stmt : asList(body, "statement list"))
      stmts.add(readControl(builder, stmt));
    return stmts;
  }

  private Control readInvoke(Builder builder, Object body) throws MalformedControlException {
    Component comp = builder.getComponent();
    String cellName;
    Map<String, Integer> inputs = new HashMap<>();
    Map<String, Integer> outputs = new HashMap<>();
    if (body instanceof String) {
      cellName = (String)body;
    } else {
      Map<String, Object> desc = asMap(body, "invoke");
      cellName = asString(desc.get("cell"), "invoked cell");
      for (Map.Entry<String, Object> in : asMap(desc.getOrDefault("inputs", Map.of()), "inputs").entrySet())
        inputs.put(in.getKey(), readPort(builder, asString(in.getValue(), "input " + in.getKey())));
      for (Map.Entry<String, Object> out : asMap(desc.getOrDefault("outputs", Map.of()), "outputs").entrySet())
        outputs.put(out.getKey(), readPort(builder, asString(out.getValue(), "output " + out.getKey())));
    }
    Cell cell = comp.findCell(cellName).orElseThrow(() -> new MalformedControlException("Invoke of unknown cell " + cellName));
    return new Control.Invoke(cell.getIndex(), inputs, outputs, new Attributes());
  }

  private static Optional<Integer> readCondGroup(Component comp, Map<String, Object> desc, Attributes attrs)
      throws MalformedControlException {
    if (!desc.containsKey("with"))
      return Optional.empty();
    Group cond = findGroup(comp, desc.get("with"), attrs);
    if (!cond.isCombinational())
      throw new MalformedControlException("Condition group " + cond.getName() + " is not combinational", attrs.getPos());
    return Optional.of(cond.getIndex());
  }

  private static Group findGroup(Component comp, Object nameObj, Attributes attrs) throws MalformedControlException {
    String groupName = asString(nameObj, "group name");
    return comp.findGroup(groupName)
        .orElseThrow(() -> new MalformedControlException("Unknown group " + groupName, attrs.getPos()));
  }

  private static long requireLatency(OptionalLong latency, String kind, Attributes attrs) throws MalformedControlException {
    if (latency.isEmpty())
      throw new MalformedControlException(kind + " requires a static latency", attrs.getPos());
    return latency.getAsLong();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object obj, String what) throws MalformedControlException {
    if (!(obj instanceof Map))
      throw new MalformedControlException("Expected a map for " + what + ", got " + obj);
    return (Map<String, Object>)obj;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object obj, String what) throws MalformedControlException {
    if (!(obj instanceof List))
      throw new MalformedControlException("Expected a list for " + what + ", got " + obj);
    return (List<Object>)obj;
  }

  private static String asString(Object obj, String what) throws MalformedControlException {
    if (!(obj instanceof String))
      throw new MalformedControlException("Expected a string for " + what + ", got " + obj);
    return (String)obj;
  }

  private static long asLong(Object obj, String what) throws MalformedControlException {
    if (!(obj instanceof Number))
      throw new MalformedControlException("Expected a number for " + what + ", got " + obj);
    return ((Number)obj).longValue();
  }

  private static boolean asBoolean(Object obj, String what) throws MalformedControlException {
    if (!(obj instanceof Boolean))
      throw new MalformedControlException("Expected true or false for " + what + ", got " + obj);
    return (Boolean)obj;
  }
}
