package pass.IRPass.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DiffRangeTest {

  @Test
  public void testSinglePointConstructor() {
    DiffRange point = new DiffRange(true, 0, 5);
    assertEquals(5, point.getLow());
    assertEquals(6, point.getHigh());
    assertTrue(point.isCertain());
  }

  @Test
  public void testAddKeepsFixedHighCorrection() {
    DiffRange sum = new DiffRange(true, 1, 0, 10).add(new DiffRange(true, 0, 5, 6));
    assertEquals(new DiffRange(true, 1, 5, 15), sum);
  }

  @Test
  public void testSubUsesCrossedBounds() {
    DiffRange diff = new DiffRange(true, 1, 0, 10).sub(new DiffRange(true, 0, 5));
    assertEquals(1, diff.getCoeff());
    assertEquals(-5, diff.getLow());
    assertEquals(5, diff.getHigh());
  }

  @Test
  public void testSubOfTwoPointsIsAPoint() {
    DiffRange diff = new DiffRange(true, 0, 7).sub(new DiffRange(true, 0, 3));
    assertEquals(new DiffRange(true, 0, 4), diff);
    assertTrue(diff.isCertain());
  }

  @Test
  public void testCoefficientsCancel() {
    DiffRange index = new DiffRange(true, 1, 0);
    DiffRange diff = index.add(new DiffRange(true, 0, 2)).sub(index);
    assertEquals(0, diff.getCoeff());
    assertEquals(new DiffRange(true, 0, 2), diff);
  }

  @Test
  public void testUnrelatedPropagates() {
    DiffRange related = new DiffRange(true, 1, 0, 10);
    assertFalse(DiffRange.unrelated().add(related).isRelated());
    assertFalse(related.add(DiffRange.unrelated()).isRelated());
    assertFalse(DiffRange.unrelated().sub(related).isRelated());
    assertFalse(related.sub(DiffRange.unrelated()).isRelated());
  }

  @Test
  public void testUnrelatedIgnoresPayload() {
    DiffRange garbage = new DiffRange(false, 3, 4, 9);
    assertEquals(DiffRange.unrelated(), garbage);
    assertEquals(DiffRange.unrelated().hashCode(), garbage.hashCode());
    assertFalse(garbage.isCertain());
    assertNotEquals(DiffRange.unrelated(), new DiffRange(true, 0, 0, 0));
  }

  @Test
  public void testOverflowLosesRelation() {
    DiffRange top = new DiffRange(true, 0, Integer.MAX_VALUE - 1);
    assertFalse(top.add(new DiffRange(true, 0, 1)).isRelated());
    DiffRange bottom = new DiffRange(true, 0, Integer.MIN_VALUE);
    assertFalse(bottom.sub(new DiffRange(true, 0, 1)).isRelated());
    assertFalse(new DiffRange(true, Integer.MAX_VALUE, 0).add(new DiffRange(true, 1, 0)).isRelated());
    assertEquals(new DiffRange(true, 0, Integer.MAX_VALUE - 1),
        new DiffRange(true, 0, Integer.MAX_VALUE - 2).add(new DiffRange(true, 0, 1)));
  }

  @Test
  public void testToString() {
    assertThat(new DiffRange(true, 2, -1, 3).toString(), is("DiffRange(2 * i + [-1, 3))"));
    assertThat(DiffRange.unrelated().toString(), containsString("unrelated"));
  }
}
