package ctrlsynth.sim;

import ctrlsynth.ir.CellDecl;
import java.util.List;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * Stateless arithmetic and comparison cells. Binary operators read {@code left} and {@code right}, unary ones read {@code in};
 * comparisons produce one bit, everything else is truncated to the cell width.
 */
public class CombPrimitive extends Primitive {
  private static final Set<String> TYPES = Set.of("std_add", "std_sub", "std_and", "std_or", "std_xor", "std_lt", "std_gt", "std_le",
                                                  "std_ge", "std_eq", "std_neq", "std_not", "std_wire", "std_const");

  public CombPrimitive(CellDecl decl) { super(decl); }

  public static boolean supports(String type) { return TYPES.contains(type); }

  @Override
  public List<String> outputs() {
    return List.of("out");
  }

  @Override
  public long output(String port, ToLongFunction<String> inputs) {
    switch (decl.type) {
    case "std_const":
      return mask(decl.param("value", 0));
    case "std_not":
      return mask(~inputs.applyAsLong("in"));
    case "std_wire":
      return mask(inputs.applyAsLong("in"));
    default:
      break;
    }
    long left = mask(inputs.applyAsLong("left"));
    long right = mask(inputs.applyAsLong("right"));
    switch (decl.type) {
    case "std_add":
      return mask(left + right);
    case "std_sub":
      return mask(left - right);
    case "std_and":
      return left & right;
    case "std_or":
      return left | right;
    case "std_xor":
      return left ^ right;
    case "std_lt":
      return Long.compareUnsigned(left, right) < 0 ? 1 : 0;
    case "std_gt":
      return Long.compareUnsigned(left, right) > 0 ? 1 : 0;
    case "std_le":
      return Long.compareUnsigned(left, right) <= 0 ? 1 : 0;
    case "std_ge":
      return Long.compareUnsigned(left, right) >= 0 ? 1 : 0;
    case "std_eq":
      return (left == right) ? 1 : 0;
    case "std_neq":
      return (left != right) ? 1 : 0;
    default:
      throw new IllegalStateException("Unhandled comb type " + decl.type);
    }
  }
}
