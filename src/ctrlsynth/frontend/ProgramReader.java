package ctrlsynth.frontend;

import ctrlsynth.ir.Assignment;
import ctrlsynth.ir.CellDecl;
import ctrlsynth.ir.ControlNode;
import ctrlsynth.ir.Group;
import ctrlsynth.ir.GroupCatalog;
import ctrlsynth.ir.Latency;
import ctrlsynth.ir.Port;
import ctrlsynth.ir.Source;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a control program from YAML.
 * <pre>
 * name: main
 * cells:
 *   - {name: i, type: std_reg, width: 8}
 *   - {name: mul, type: std_delay, latency: 3}     # go/done cell, usable with invoke
 * groups:
 *   - name: incr
 *     latency: 1                                   # cycles, 'dynamic' or 'comb'
 *     assignments: ["i.in = add.out", "i.write_en = 1", "incr[done] = i.done"]
 * continuous: ["add.left = i.out", "add.right = 1"]
 * control:
 *   seq:
 *     - incr
 *     - while: {port: lt.out, with: cond, do: {seq: [incr, empty]}}
 *     - if: {port: eq.out, then: incr, else: empty}
 *     - repeat: {count: 2, do: incr}
 *     - par: [a, b]
 *     - invoke: {cell: mul, in: {in: i.out}, out: {out: x.in}}
 *     - {enable: incr, static: 1}                 # static annotation on any node
 * </pre>
 */
public class ProgramReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public record ProgramDescription(String name, GroupCatalog catalog, ControlNode control) {}

  public static ProgramDescription read(File file) throws ProgramFormatException, IOException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    }
  }

  public static ProgramDescription read(InputStream in) throws ProgramFormatException {
    Object data;
    try {
      data = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new ProgramFormatException("Invalid YAML: " + e.getMessage(), e);
    }
    return read(asMap(data, "program"));
  }

  public static ProgramDescription readString(String yaml) throws ProgramFormatException {
    Object data;
    try {
      data = new Yaml().load(yaml);
    } catch (YAMLException e) {
      throw new ProgramFormatException("Invalid YAML: " + e.getMessage(), e);
    }
    return read(asMap(data, "program"));
  }

  private static ProgramDescription read(Map<String, Object> root) throws ProgramFormatException {
    String name = (root.containsKey("name")) ? asString(root.get("name"), "name") : "main";
    GroupCatalog catalog = new GroupCatalog();
    try {
      for (Object cell : asList(root.getOrDefault("cells", List.of()), "cells"))
        catalog.addCell(readCell(asMap(cell, "cell")));
      for (Object group : asList(root.getOrDefault("groups", List.of()), "groups"))
        catalog.addGroup(readGroup(asMap(group, "group")));
    } catch (IllegalArgumentException e) {
      throw new ProgramFormatException(e.getMessage(), e);
    }
    for (Object assignment : asList(root.getOrDefault("continuous", List.of()), "continuous"))
      catalog.addContinuous(GuardParser.parseAssignment(asString(assignment, "continuous assignment")));
    if (!root.containsKey("control"))
      throw new ProgramFormatException("Program " + name + " has no control section");
    ControlNode control = readNode(root.get("control"));
    logger.debug("Read program {}: {} cells, {} groups", name, catalog.getCells().size(), catalog.getGroups().size());
    return new ProgramDescription(name, catalog, control);
  }

  private static CellDecl readCell(Map<String, Object> map) throws ProgramFormatException {
    String name = asString(require(map, "name", "cell"), "cell name");
    String type = asString(require(map, "type", "cell " + name), "cell type");
    LinkedHashMap<String, Long> params = new LinkedHashMap<>();
    Latency latency = null;
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      if (entry.getKey().equals("name") || entry.getKey().equals("type"))
        continue;
      if (entry.getKey().equals("latency")) {
        latency = readLatency(entry.getValue(), "cell " + name);
        if (latency.isStatic())
          params.put("latency", (long)latency.cycles);
        continue;
      }
      if (!(entry.getValue() instanceof Number))
        throw new ProgramFormatException("Parameter " + entry.getKey() + " of cell " + name + " must be a number");
      params.put(entry.getKey(), ((Number)entry.getValue()).longValue());
    }
    return new CellDecl(name, type, params, latency);
  }

  private static Group readGroup(Map<String, Object> map) throws ProgramFormatException {
    String name = asString(require(map, "name", "group"), "group name");
    Latency latency = readLatency(map.getOrDefault("latency", "dynamic"), "group " + name);
    List<Assignment> assignments = new ArrayList<>();
    for (Object assignment : asList(map.getOrDefault("assignments", List.of()), "assignments of " + name))
      assignments.add(GuardParser.parseAssignment(asString(assignment, "assignment in " + name)));
    return new Group(name, latency, assignments);
  }

  private static Latency readLatency(Object value, String where) throws ProgramFormatException {
    if (value instanceof Integer) {
      Integer cycles = (Integer)value;
      if (cycles < 1)
        throw new ProgramFormatException("Latency of " + where + " must be at least 1, use 'comb' for comb groups");
      return Latency.ofStatic(cycles);
    }
    String text = asString(value, "latency of " + where);
    switch (text) {
    case "dynamic":
      return Latency.DYNAMIC;
    case "comb":
      return Latency.COMBINATIONAL;
    default:
      throw new ProgramFormatException("Unknown latency '" + text + "' of " + where);
    }
  }

  static ControlNode readNode(Object data) throws ProgramFormatException {
    if (data instanceof String)
      return ((String)data).equals("empty") ? ControlNode.empty() : ControlNode.enable((String)data);
    Map<String, Object> map = asMap(data, "control node");
    ControlNode ret = null;
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      if (entry.getKey().equals("static"))
        continue;
      if (ret != null)
        throw new ProgramFormatException("Control node with several operators: " + map.keySet());
      ret = readOperator(entry.getKey(), entry.getValue());
    }
    if (ret == null)
      throw new ProgramFormatException("Control node without operator: " + map);
    if (map.containsKey("static")) {
      Object hint = map.get("static");
      if (!(hint instanceof Integer))
        throw new ProgramFormatException("Static annotation must be a cycle count, got " + hint);
      ret = ret.withStaticHint((Integer)hint);
    }
    return ret;
  }

  private static ControlNode readOperator(String operator, Object value) throws ProgramFormatException {
    switch (operator) {
    case "enable":
      return ControlNode.enable(asString(value, "enable"));
    case "empty":
      return ControlNode.empty();
    case "seq":
      return ControlNode.seq(readNodes(value, "seq"));
    case "par":
      return ControlNode.par(readNodes(value, "par"));
    case "if": {
      Map<String, Object> map = asMap(value, "if");
      Port port = GuardParser.parsePort(asString(require(map, "port", "if"), "if port"));
      ControlNode thenBranch = readNode(require(map, "then", "if"));
      ControlNode elseBranch = map.containsKey("else") ? readNode(map.get("else")) : ControlNode.empty();
      if (map.containsKey("with"))
        return ControlNode.ifComb(port, asString(map.get("with"), "if condition group"), thenBranch, elseBranch);
      return ControlNode.ifPort(port, thenBranch, elseBranch);
    }
    case "while": {
      Map<String, Object> map = asMap(value, "while");
      Port port = GuardParser.parsePort(asString(require(map, "port", "while"), "while port"));
      ControlNode body = readNode(require(map, "do", "while"));
      if (map.containsKey("with"))
        return ControlNode.whileComb(port, asString(map.get("with"), "while condition group"), body);
      return ControlNode.whilePort(port, body);
    }
    case "repeat": {
      Map<String, Object> map = asMap(value, "repeat");
      Object count = require(map, "count", "repeat");
      if (!(count instanceof Integer))
        throw new ProgramFormatException("Repeat count must be an integer, got " + count);
      return ControlNode.repeat((Integer)count, readNode(require(map, "do", "repeat")));
    }
    case "invoke": {
      Map<String, Object> map = asMap(value, "invoke");
      String cell = asString(require(map, "cell", "invoke"), "invoked cell");
      LinkedHashMap<String, Source> inputs = new LinkedHashMap<>();
      for (Map.Entry<String, Object> input : asMap(map.getOrDefault("in", Map.of()), "invoke inputs").entrySet())
        inputs.put(input.getKey(), GuardParser.parseSource(String.valueOf(input.getValue())));
      LinkedHashMap<String, Port> outputs = new LinkedHashMap<>();
      for (Map.Entry<String, Object> output : asMap(map.getOrDefault("out", Map.of()), "invoke outputs").entrySet())
        outputs.put(output.getKey(), GuardParser.parsePort(asString(output.getValue(), "invoke output")));
      return ControlNode.invoke(cell, inputs, outputs);
    }
    default:
      throw new ProgramFormatException("Unknown control operator '" + operator + "'");
    }
  }

  private static List<ControlNode> readNodes(Object value, String where) throws ProgramFormatException {
    List<ControlNode> ret = new ArrayList<>();
    for (Object child : asList(value, where))
      ret.add(readNode(child));
    return ret;
  }

  private static Object require(Map<String, Object> map, String key, String where) throws ProgramFormatException {
    if (!map.containsKey(key))
      throw new ProgramFormatException("Missing '" + key + "' in " + where);
    return map.get(key);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object value, String where) throws ProgramFormatException {
    if (!(value instanceof Map))
      throw new ProgramFormatException("Expected a map for " + where + ", got " + value);
    return (Map<String, Object>)value;
  }

  private static List<?> asList(Object value, String where) throws ProgramFormatException {
    if (!(value instanceof List))
      throw new ProgramFormatException("Expected a list for " + where + ", got " + value);
    return (List<?>)value;
  }

  private static String asString(Object value, String where) throws ProgramFormatException {
    if (!(value instanceof String))
      throw new ProgramFormatException("Expected a string for " + where + ", got " + value);
    return (String)value;
  }
}
