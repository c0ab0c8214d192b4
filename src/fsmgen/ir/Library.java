package fsmgen.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Collection of primitive signatures available to components.
 */
public class Library {
  private final LinkedHashMap<String, Primitive> primitives = new LinkedHashMap<>();

  public void add(Primitive prim) { primitives.put(prim.getName(), prim); }

  public Optional<Primitive> find(String name) { return Optional.ofNullable(primitives.get(name)); }

  public Collection<Primitive> getPrimitives() { return Collections.unmodifiableCollection(primitives.values()); }

  /**
   * Builds the library of standard primitives: registers, combinational arithmetic and comparison units, wires, a
   * pipelined multiplier and a one-dimensional memory.
   */
  public static Library standard() {
    Library lib = new Library();

    Primitive reg = new Primitive("std_reg", List.of("WIDTH"));
    reg.addPort("in", Direction.Input, "WIDTH");
    reg.addPort("write_en", Direction.Input, 1);
    reg.addPort("clk", Direction.Input, 1);
    reg.addPort("reset", Direction.Input, 1);
    reg.addPort("out", Direction.Output, "WIDTH").with(Attr.Stable, 1);
    reg.addPort("done", Direction.Output, 1).with(Attr.Done, 1);
    lib.add(reg);

    for (String binop : List.of("std_add", "std_sub", "std_and", "std_or", "std_lsh", "std_rsh")) {
      Primitive prim = new Primitive(binop, List.of("WIDTH"));
      prim.addPort("left", Direction.Input, "WIDTH");
      prim.addPort("right", Direction.Input, "WIDTH");
      prim.addPort("out", Direction.Output, "WIDTH");
      lib.add(prim);
    }
    for (String cmp : List.of("std_eq", "std_neq", "std_lt", "std_le", "std_gt", "std_ge")) {
      Primitive prim = new Primitive(cmp, List.of("WIDTH"));
      prim.addPort("left", Direction.Input, "WIDTH");
      prim.addPort("right", Direction.Input, "WIDTH");
      prim.addPort("out", Direction.Output, 1);
      lib.add(prim);
    }
    for (String unop : List.of("std_not", "std_wire")) {
      Primitive prim = new Primitive(unop, List.of("WIDTH"));
      prim.addPort("in", Direction.Input, "WIDTH");
      prim.addPort("out", Direction.Output, "WIDTH");
      lib.add(prim);
    }

    Primitive mult = new Primitive("std_mult_pipe", List.of("WIDTH"));
    mult.addPort("left", Direction.Input, "WIDTH");
    mult.addPort("right", Direction.Input, "WIDTH");
    mult.addPort("go", Direction.Input, 1);
    mult.addPort("clk", Direction.Input, 1);
    mult.addPort("reset", Direction.Input, 1);
    mult.addPort("out", Direction.Output, "WIDTH").with(Attr.Stable, 1);
    mult.addPort("done", Direction.Output, 1).with(Attr.Done, 1);
    lib.add(mult);

    // read_data is combinational in addr0 only
    Primitive mem = new Primitive("std_mem_d1", List.of("WIDTH", "SIZE", "IDX_SIZE"));
    mem.addPort("addr0", Direction.Input, "IDX_SIZE").with(Attr.ReadTogether, 1);
    mem.addPort("write_data", Direction.Input, "WIDTH");
    mem.addPort("write_en", Direction.Input, 1);
    mem.addPort("clk", Direction.Input, 1);
    mem.addPort("reset", Direction.Input, 1);
    mem.addPort("read_data", Direction.Output, "WIDTH").with(Attr.ReadTogether, 1);
    mem.addPort("done", Direction.Output, 1).with(Attr.Done, 1);
    lib.add(mem);

    return lib;
  }
}
