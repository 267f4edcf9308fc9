package io.loglog.sketch;

import com.google.common.base.Supplier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CardinalityEstimatorsTest
{
  @Test
  public void testPrecisionForms()
  {
    assertEquals(CardinalityEstimators.DEFAULT_PRECISION, CardinalityEstimators.get("hll").precision());
    assertEquals(12, CardinalityEstimators.get("hll12").precision());
    assertEquals(14, CardinalityEstimators.get("hll@0.01").precision());
    assertEquals(16, CardinalityEstimators.get("hll@0.00408").precision());
    assertEquals("hll12", CardinalityEstimators.get("hll12").name());
  }

  @Test
  public void testExplicitSeed() throws CardinalityMergeException
  {
    HyperLogLog first = CardinalityEstimators.get("hll16#1f:ffffffffffffffff");
    assertEquals(HashSeed.of(0x1fL, -1L), first.seed());

    HyperLogLog second = CardinalityEstimators.get("hll16#1f:ffffffffffffffff");
    first.add("a");
    second.add("b");
    first.merge(second);
    assertEquals(2L, first.cardinality());
  }

  @Test
  public void testRandomSeedsDiffer()
  {
    HyperLogLog first = CardinalityEstimators.get("hll10");
    HyperLogLog second = CardinalityEstimators.get("hll10");
    assertThrows(CardinalityMergeException.class, () -> first.merge(second));
  }

  @Test
  public void testLazyGetSuppliesMergeableEstimators() throws CardinalityMergeException
  {
    Supplier<HyperLogLog> supplier = CardinalityEstimators.lazyGet("hll@0.01");
    HyperLogLog first = supplier.get();
    HyperLogLog second = supplier.get();
    assertNotSame(first, second);
    assertEquals(first.seed(), second.seed());

    first.add("a");
    second.add("a");
    second.add("b");
    first.merge(second);
    assertEquals(2L, first.cardinality());
  }

  @Test
  public void testUnknownEstimators()
  {
    for (String name : new String[] {"uniq", "hllx", "hll3", "hll19", "hll@2", "hll@abc", "hll12#zz", "hll12#1:xyz"}) {
      assertThrows(IllegalArgumentException.class, () -> CardinalityEstimators.get(name), name);
    }
  }
}
