package fsmgen.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A node of the control program. The set of node kinds is closed ({@link Kind}); passes switch over
 * {@link #getKind()} instead of dispatching through a visitor.
 * <p>
 * Statically timed kinds always carry a {@link Attr#Static} attribute. Children are owned: passes that restructure
 * the tree build new nodes and return them, while attribute-only passes update {@link #getAttributes()} in place.
 */
public abstract class Control {
  public enum Kind { Enable, StaticEnable, Invoke, Seq, StaticSeq, Par, StaticPar, If, StaticIf, While, Repeat, StaticRepeat, Empty }

  protected final Attributes attributes;

  protected Control(Attributes attributes) { this.attributes = attributes; }

  public abstract Kind getKind();

  public Attributes getAttributes() { return attributes; }

  /** The {@link Attr#Static} latency, if known. */
  public OptionalLong getLatency() { return attributes.get(Attr.Static); }

  /** True for the statically timed kinds (StaticEnable, StaticSeq, StaticPar, StaticIf, StaticRepeat). */
  public boolean isStaticKind() {
    switch (getKind()) {
    case StaticEnable:
    case StaticSeq:
    case StaticPar:
    case StaticIf:
    case StaticRepeat:
      return true;
    default:
      return false;
    }
  }

  private static Attributes staticAttrs(long latency) {
    if (latency < 0)
      throw new IllegalArgumentException("Negative latency " + latency);
    return new Attributes().insert(Attr.Static, latency);
  }

  public static Enable enable(int group) { return new Enable(group, false, new Attributes()); }
  public static Enable staticEnable(int group, long latency) { return new Enable(group, true, staticAttrs(latency)); }
  public static Seq seq(List<Control> stmts) { return new Seq(stmts, false, new Attributes()); }
  public static Seq staticSeq(List<Control> stmts, long latency) { return new Seq(stmts, true, staticAttrs(latency)); }
  public static Par par(List<Control> stmts) { return new Par(stmts, false, new Attributes()); }
  public static Par staticPar(List<Control> stmts, long latency) { return new Par(stmts, true, staticAttrs(latency)); }
  public static If ifElse(int port, Optional<Integer> cond, Control tbranch, Control fbranch) {
    return new If(port, cond, tbranch, fbranch, false, new Attributes());
  }
  public static If staticIf(int port, Control tbranch, Control fbranch, long latency) {
    return new If(port, Optional.empty(), tbranch, fbranch, true, staticAttrs(latency));
  }
  public static While whileLoop(int port, Optional<Integer> cond, Control body) { return new While(port, cond, body, new Attributes()); }
  public static Repeat repeat(long count, Control body) { return new Repeat(count, body, false, new Attributes()); }
  public static Repeat staticRepeat(long count, Control body, long latency) { return new Repeat(count, body, true, staticAttrs(latency)); }
  public static Empty empty() { return new Empty(new Attributes()); }

  /** Enables a group, statically timed or not. */
  public static class Enable extends Control {
    private final int group;
    private final boolean isStatic;
    public Enable(int group, boolean isStatic, Attributes attributes) {
      super(attributes);
      this.group = group;
      this.isStatic = isStatic;
    }
    /** Arena index of the enabled group. */
    public int getGroup() { return group; }
    @Override
    public Kind getKind() {
      return isStatic ? Kind.StaticEnable : Kind.Enable;
    }
  }

  /** Invokes a sub-component cell with port bindings. */
  public static class Invoke extends Control {
    private final int cell;
    private final LinkedHashMap<String, Integer> inputs;
    private final LinkedHashMap<String, Integer> outputs;
    public Invoke(int cell, Map<String, Integer> inputs, Map<String, Integer> outputs, Attributes attributes) {
      super(attributes);
      this.cell = cell;
      this.inputs = new LinkedHashMap<>(inputs);
      this.outputs = new LinkedHashMap<>(outputs);
    }
    public int getCell() { return cell; }
    /** Callee input port name to the arena index of the driving port. */
    public Map<String, Integer> getInputs() { return Collections.unmodifiableMap(inputs); }
    /** Callee output port name to the arena index of the receiving port. */
    public Map<String, Integer> getOutputs() { return Collections.unmodifiableMap(outputs); }
    @Override
    public Kind getKind() {
      return Kind.Invoke;
    }
  }

  /** Common base of {@link Seq} and {@link Par}. */
  public abstract static class Block extends Control {
    private final List<Control> stmts;
    private final boolean isStatic;
    protected Block(List<Control> stmts, boolean isStatic, Attributes attributes) {
      super(attributes);
      this.stmts = new ArrayList<>(stmts);
      this.isStatic = isStatic;
    }
    public List<Control> getStmts() { return Collections.unmodifiableList(stmts); }
    public boolean isStatic() { return isStatic; }
  }

  public static class Seq extends Block {
    public Seq(List<Control> stmts, boolean isStatic, Attributes attributes) { super(stmts, isStatic, attributes); }
    @Override
    public Kind getKind() {
      return isStatic() ? Kind.StaticSeq : Kind.Seq;
    }
  }

  public static class Par extends Block {
    public Par(List<Control> stmts, boolean isStatic, Attributes attributes) { super(stmts, isStatic, attributes); }
    @Override
    public Kind getKind() {
      return isStatic() ? Kind.StaticPar : Kind.Par;
    }
  }

  public static class If extends Control {
    private final int port;
    private final Optional<Integer> cond;
    private final Control tbranch;
    private final Control fbranch;
    private final boolean isStatic;
    public If(int port, Optional<Integer> cond, Control tbranch, Control fbranch, boolean isStatic, Attributes attributes) {
      super(attributes);
      this.port = port;
      this.cond = cond;
      this.tbranch = tbranch;
      this.fbranch = fbranch;
      this.isStatic = isStatic;
    }
    /** Arena index of the condition port. */
    public int getPort() { return port; }
    /** Arena index of the combinational group computing the condition, if any. */
    public Optional<Integer> getCond() { return cond; }
    public Control getThen() { return tbranch; }
    public Control getElse() { return fbranch; }
    public boolean isStatic() { return isStatic; }
    /** Copy with new branches and the same port, condition group, kind and attributes. */
    public If withBranches(Control newThen, Control newElse) {
      return new If(port, cond, newThen, newElse, isStatic, new Attributes(attributes));
    }
    @Override
    public Kind getKind() {
      return isStatic ? Kind.StaticIf : Kind.If;
    }
  }

  public static class While extends Control {
    private final int port;
    private final Optional<Integer> cond;
    private final Control body;
    public While(int port, Optional<Integer> cond, Control body, Attributes attributes) {
      super(attributes);
      this.port = port;
      this.cond = cond;
      this.body = body;
    }
    public int getPort() { return port; }
    public Optional<Integer> getCond() { return cond; }
    public Control getBody() { return body; }
    public While withBody(Control newBody) { return new While(port, cond, newBody, new Attributes(attributes)); }
    @Override
    public Kind getKind() {
      return Kind.While;
    }
  }

  public static class Repeat extends Control {
    private final long count;
    private final Control body;
    private final boolean isStatic;
    public Repeat(long count, Control body, boolean isStatic, Attributes attributes) {
      super(attributes);
      this.count = count;
      this.body = body;
      this.isStatic = isStatic;
    }
    public long getCount() { return count; }
    public Control getBody() { return body; }
    public boolean isStatic() { return isStatic; }
    public Repeat withBody(long newCount, Control newBody) { return new Repeat(newCount, newBody, isStatic, new Attributes(attributes)); }
    @Override
    public Kind getKind() {
      return isStatic ? Kind.StaticRepeat : Kind.Repeat;
    }
  }

  public static class Empty extends Control {
    public Empty(Attributes attributes) { super(attributes); }
    @Override
    public Kind getKind() {
      return Kind.Empty;
    }
  }
}
