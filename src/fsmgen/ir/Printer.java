package fsmgen.ir;

import java.util.stream.Collectors;

/**
 * Renders IR objects in a source-like textual syntax, for diagnostics and FSM dumps.
 */
public class Printer {
  private Printer() {}

  /** {@code dst = guard ? src;}, with the guard omitted if it is true. */
  public static String assignmentToString(Component comp, Assignment assign) {
    StringBuilder sb = new StringBuilder();
    sb.append(comp.portName(assign.getDst())).append(" = ");
    if (!assign.getGuard().isTrue())
      sb.append(guardToString(comp, assign.getGuard())).append(" ? ");
    sb.append(comp.portName(assign.getSrc())).append(';');
    return sb.toString();
  }

  public static String guardToString(Component comp, Guard guard) {
    switch (guard.getKind()) {
    case True:
      return "1'd1";
    case Port:
      return comp.portName(((Guard.PortGuard)guard).getPort());
    case CompOp: {
      Guard.CompOpGuard cmp = (Guard.CompOpGuard)guard;
      return comp.portName(cmp.getLeft()) + " " + cmp.getOp().getOp() + " " + comp.portName(cmp.getRight());
    }
    case And:
    case Or: {
      Guard.BinaryGuard bin = (Guard.BinaryGuard)guard;
      String op = guard.getKind() == Guard.Kind.And ? " & " : " | ";
      return operand(comp, bin.getLeft(), guard.getKind()) + op + operand(comp, bin.getRight(), guard.getKind());
    }
    case Not: {
      Guard inner = ((Guard.NotGuard)guard).getInner();
      boolean atomic = inner.getKind() == Guard.Kind.Port || inner.getKind() == Guard.Kind.True;
      return atomic ? "!" + guardToString(comp, inner) : "!(" + guardToString(comp, inner) + ")";
    }
    case StaticInterval: {
      Guard.StaticIntervalGuard interval = (Guard.StaticIntervalGuard)guard;
      return "%[" + interval.getBegin() + ":" + interval.getEnd() + "]";
    }
    default:
      throw new IllegalStateException("Internal error: unknown guard kind " + guard.getKind());
    }
  }

  // Parenthesizes a binary operand unless it is of the same kind as its parent.
  private static String operand(Component comp, Guard guard, Guard.Kind parent) {
    String text = guardToString(comp, guard);
    boolean binary = guard.getKind() == Guard.Kind.And || guard.getKind() == Guard.Kind.Or;
    boolean comparison = guard.getKind() == Guard.Kind.CompOp;
    return ((binary && guard.getKind() != parent) || comparison) ? "(" + text + ")" : text;
  }

  public static String groupToString(Component comp, Group group) {
    StringBuilder sb = new StringBuilder();
    if (group.isCombinational())
      sb.append("comb ");
    sb.append("group ").append(group.getName());
    if (!group.getAttributes().isEmpty())
      sb.append(" <").append(group.getAttributes()).append('>');
    sb.append(" {\n");
    for (Assignment assign : group.assignments)
      sb.append("  ").append(assignmentToString(comp, assign)).append('\n');
    sb.append("}\n");
    return sb.toString();
  }

  public static String controlToString(Component comp, Control con) {
    StringBuilder sb = new StringBuilder();
    writeControl(comp, con, 0, sb);
    return sb.toString();
  }

  private static void writeControl(Component comp, Control con, int indent, StringBuilder sb) {
    String pad = " ".repeat(indent);
    sb.append(pad);
    if (!con.getAttributes().isEmpty())
      sb.append(con.getAttributes()).append(' ');
    switch (con.getKind()) {
    case Enable:
    case StaticEnable:
      sb.append(comp.getGroup(((Control.Enable)con).getGroup()).getName()).append(";\n");
      break;
    case Invoke: {
      Control.Invoke invoke = (Control.Invoke)con;
      sb.append("invoke ").append(comp.getCell(invoke.getCell()).getName()).append('(');
      sb.append(invoke.getInputs()
                    .entrySet()
                    .stream()
                    .map(e -> e.getKey() + "=" + comp.portName(e.getValue()))
                    .collect(Collectors.joining(", ")));
      sb.append(")(");
      sb.append(invoke.getOutputs()
                    .entrySet()
                    .stream()
                    .map(e -> e.getKey() + "=" + comp.portName(e.getValue()))
                    .collect(Collectors.joining(", ")));
      sb.append(");\n");
      break;
    }
    case Seq:
    case StaticSeq:
    case Par:
    case StaticPar: {
      Control.Block block = (Control.Block)con;
      if (block.isStatic())
        sb.append("static ");
      sb.append(con instanceof Control.Seq ? "seq" : "par").append(" {\n");
      for (Control stmt : block.getStmts())
        writeControl(comp, stmt, indent + 2, sb);
      sb.append(pad).append("}\n");
      break;
    }
    case If:
    case StaticIf: {
      Control.If ifNode = (Control.If)con;
      if (ifNode.isStatic())
        sb.append("static ");
      sb.append("if ").append(comp.portName(ifNode.getPort()));
      ifNode.getCond().ifPresent(cg -> sb.append(" with ").append(comp.getGroup(cg).getName()));
      sb.append(" {\n");
      writeControl(comp, ifNode.getThen(), indent + 2, sb);
      sb.append(pad).append('}');
      if (ifNode.getElse().getKind() != Control.Kind.Empty) {
        sb.append(" else {\n");
        writeControl(comp, ifNode.getElse(), indent + 2, sb);
        sb.append(pad).append('}');
      }
      sb.append('\n');
      break;
    }
    case While: {
      Control.While wh = (Control.While)con;
      sb.append("while ").append(comp.portName(wh.getPort()));
      wh.getCond().ifPresent(cg -> sb.append(" with ").append(comp.getGroup(cg).getName()));
      sb.append(" {\n");
      writeControl(comp, wh.getBody(), indent + 2, sb);
      sb.append(pad).append("}\n");
      break;
    }
    case Repeat:
    case StaticRepeat: {
      Control.Repeat rep = (Control.Repeat)con;
      if (rep.isStatic())
        sb.append("static ");
      sb.append("repeat ").append(rep.getCount()).append(" {\n");
      writeControl(comp, rep.getBody(), indent + 2, sb);
      sb.append(pad).append("}\n");
      break;
    }
    case Empty:
      sb.append("empty;\n");
      break;
    }
  }
}
