package ir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import ir.type.IntegerType;
import ir.value.Argument;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantVector;
import ir.value.instructions.BinOperator;
import ir.value.instructions.ElementShuffleInst;
import ir.value.instructions.ElementShuffleInst.VectorElement;

import java.util.List;

import org.junit.Test;

public class BuilderTest {

  @Test
  public void testNamePrefixAndTemps() {
    Builder builder = new Builder("k");
    Argument a = builder.buildArg(IntegerType.getI32(), "a");
    BinOperator t = builder.buildAdd(a, a, null);
    assertEquals("k.a", a.getName());
    assertEquals("k.t0", t.getName());
    assertEquals("t0", new Builder().buildArg(IntegerType.getI32(), "").getName());
  }

  @Test
  public void testNodesInCreationOrder() {
    Builder builder = new Builder();
    ConstantInt c = builder.getInt32(2);
    Argument a = builder.buildArg(IntegerType.getI32(), "a");
    BinOperator x = builder.buildSub(a, c, "x");
    assertThat(builder.getNodes(), contains((Value) c, a, x));
    assertSame(a, x.getLhs());
    assertSame(c, x.getRhs());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testOperandsAreReadOnly() {
    Builder builder = new Builder();
    Argument a = builder.buildArg(IntegerType.getI32(), "a");
    builder.buildAdd(a, a, "x").getOperands().clear();
  }

  @Test
  public void testShuffleKeepsEachSourceOnce() {
    Builder builder = new Builder();
    ConstantVector v = builder.getVector(IntegerType.getI32(),
        List.of(ConstantInt.i32(1), ConstantInt.i32(2)));
    ElementShuffleInst swap = builder.buildShuffle(
        List.of(new VectorElement(v, 1), new VectorElement(v, 0)), "swap");
    assertEquals(1, swap.getNumOperands());
    assertTrue(swap.usesValue(v));
    assertEquals(2, swap.getWidth());
  }
}
