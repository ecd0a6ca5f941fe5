package pass.IRPass.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static pass.IRPass.analysis.ValueDiffAnalysis.findBaseAndOffset;
import static pass.IRPass.analysis.ValueDiffAnalysis.valueDiffPtrIndex;

import exception.CompileException;
import ir.Builder;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.value.Argument;
import ir.value.Value;
import ir.value.constants.ConstantInt;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ValueDiffPtrIndexTest {

  private Builder builder;
  private Argument a;
  private Argument b;

  @Before
  public void setUp() {
    builder = new Builder();
    a = builder.buildArg(IntegerType.getI32(), "a");
    b = builder.buildArg(IntegerType.getI32(), "b");
  }

  @Test
  public void testReflexive() {
    assertEquals(DiffPtrResult.certain(0), valueDiffPtrIndex(a, a));
    Value load = builder.buildLoad(builder.buildArg(PointerType.get(IntegerType.getI32()), "p"), "ld");
    assertEquals(DiffPtrResult.certain(0), valueDiffPtrIndex(load, load));
    Value product = builder.buildMul(a, b, "m");
    assertEquals(DiffPtrResult.certain(0), valueDiffPtrIndex(product, product));
  }

  @Test
  public void testConstantsFold() {
    ConstantInt c7 = builder.getInt32(7);
    ConstantInt c3 = builder.getInt32(3);
    assertEquals(DiffPtrResult.certain(4), valueDiffPtrIndex(c7, c3));
    assertEquals(DiffPtrResult.certain(-4), valueDiffPtrIndex(c3, c7));
  }

  @Test
  public void testDistinctEqualConstantsDiffByZero() {
    assertEquals(DiffPtrResult.certain(0), valueDiffPtrIndex(builder.getInt32(5), builder.getInt32(5)));
  }

  @Test
  public void testSameBaseOffsets() {
    Value x = builder.buildAdd(a, builder.getInt32(3), "x");
    Value y = builder.buildSub(a, builder.getInt32(2), "y");
    DiffPtrResult forward = valueDiffPtrIndex(x, y);
    assertTrue(forward.isDiffCertain());
    assertEquals(5, forward.getDiffRange());
    assertEquals(DiffPtrResult.certain(-5), valueDiffPtrIndex(y, x));
  }

  @Test
  public void testStructurallyEqualExpressionsShareBase() {
    Value x1 = builder.buildAdd(a, builder.getInt32(3), "x1");
    Value x2 = builder.buildAdd(a, builder.getInt32(3), "x2");
    assertEquals(DiffPtrResult.certain(0), valueDiffPtrIndex(x1, x2));
  }

  @Test
  public void testDifferentBasesAreUncertain() {
    Value x = builder.buildAdd(a, builder.getInt32(3), "x");
    Value y = builder.buildAdd(b, builder.getInt32(3), "y");
    assertFalse(valueDiffPtrIndex(x, y).isDiffCertain());
  }

  @Test
  public void testBaseIsComparedByIdentity() {
    // a + b built twice: equal values, distinct base nodes
    Value base1 = builder.buildAdd(a, b, "s1");
    Value base2 = builder.buildAdd(a, b, "s2");
    Value x = builder.buildAdd(base1, builder.getInt32(1), "x");
    Value y = builder.buildAdd(base2, builder.getInt32(1), "y");
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(x, y));
  }

  @Test
  public void testValueAgainstItsOwnBaseIsUncertain() {
    ConstantInt x = builder.getInt32(5);
    Value y = builder.buildAdd(x, builder.getInt32(3), "y");
    BaseOffset decomposed = findBaseAndOffset(y);
    assertTrue(decomposed.isFound());
    assertThat(decomposed.getBase(), sameInstance((Value) x));
    assertEquals(3, decomposed.getOffset());
    // x is a plain constant (no base) while y is based on x
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(y, x));
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(builder.buildAdd(a, builder.getInt32(1), "z"), a));
  }

  @Test
  public void testOnlyOneHop() {
    Value x = builder.buildAdd(a, builder.getInt32(3), "x");
    Value z = builder.buildAdd(x, builder.getInt32(1), "z");
    BaseOffset decomposed = findBaseAndOffset(z);
    assertThat(decomposed.getBase(), sameInstance(x));
    assertEquals(1, decomposed.getOffset());
    assertFalse(valueDiffPtrIndex(z, x).isDiffCertain());
  }

  @Test
  public void testConstantDecomposition() {
    BaseOffset decomposed = findBaseAndOffset(builder.getInt32(-8));
    assertTrue(decomposed.isFound());
    assertFalse(decomposed.hasBase());
    assertNull(decomposed.getBase());
    assertEquals(-8, decomposed.getOffset());
  }

  @Test
  public void testSubNegatesOffset() {
    BaseOffset decomposed = findBaseAndOffset(builder.buildSub(a, builder.getInt32(4), "x"));
    assertThat(decomposed.getBase(), sameInstance((Value) a));
    assertEquals(-4, decomposed.getOffset());
  }

  @Test
  public void testNonConstantOffsetIsNotFound() {
    assertFalse(findBaseAndOffset(builder.buildAdd(a, b, "x")).isFound());
    assertFalse(valueDiffPtrIndex(builder.buildAdd(a, b, "y"), a).isDiffCertain());
  }

  @Test
  public void testConstantOnTheLeftIsNotFound() {
    assertFalse(findBaseAndOffset(builder.buildAdd(builder.getInt32(3), a, "x")).isFound());
  }

  @Test
  public void testOtherShapesAreNotFound() {
    assertFalse(findBaseAndOffset(a).isFound());
    assertFalse(findBaseAndOffset(builder.buildMul(a, builder.getInt32(2), "m")).isFound());
    assertFalse(findBaseAndOffset(builder.getInt(IntegerType.getI64(), 2)).isFound());
    Argument wide = builder.buildArg(IntegerType.getI64(), "w");
    assertFalse(findBaseAndOffset(builder.buildAdd(wide, builder.getInt(IntegerType.getI64(), 2), "x")).isFound());
    assertFalse(findBaseAndOffset(builder.getFloat(2f)).isFound());
  }

  @Test
  public void testUnknownSidePoisonsDiff() {
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(a, b));
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(builder.getInt32(1), a));
  }

  @Test
  public void testOverflowingDiffIsUncertain() {
    ConstantInt max = builder.getInt32(Integer.MAX_VALUE);
    ConstantInt min = builder.getInt32(Integer.MIN_VALUE);
    assertEquals(DiffPtrResult.uncertain(), valueDiffPtrIndex(max, min));
    assertEquals(DiffPtrResult.certain(1), valueDiffPtrIndex(max, builder.getInt32(Integer.MAX_VALUE - 1)));
    assertFalse(findBaseAndOffset(builder.buildSub(a, min, "x")).isFound());
  }

  @Test(expected = CompileException.class)
  public void testVectorConstantIsRejected() {
    findBaseAndOffset(builder.getVector(IntegerType.getI32(),
        List.of(ConstantInt.i32(1), ConstantInt.i32(2))));
  }

  @Test
  public void testResultToString() {
    assertThat(DiffPtrResult.certain(3).toString(), is("Certain(3)"));
    assertThat(DiffPtrResult.uncertain().toString(), is("Uncertain"));
  }
}
