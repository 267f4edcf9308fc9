package io.loglog.sketch;

import com.google.common.hash.Funnels;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class HyperLogLogTest
{
  private static final HashSeed SEED = HashSeed.of(0x0123456789abcdefL, 0xfedcba9876543210L);
  private static final String[] KEYS = {"test1", "test2", "test3", "test2", "test2", "test2"};
  private static final String[] KEYS2 = {"test3", "test4", "test4", "test4", "test4", "test1"};

  private static HyperLogLog counterOf(HyperLogLog hll, String... keys)
  {
    for (String key : keys) {
      hll.add(key);
    }
    return hll;
  }

  @Test
  public void testSimpleCountAndClear()
  {
    HyperLogLog hll = counterOf(HyperLogLog.withErrorRate(0.00408, SEED), KEYS);
    assertEquals(3L, Math.round(hll.estimate()));
    assertEquals(3L, hll.cardinality());
    assertFalse(hll.isEmpty());

    hll.clear();
    assertTrue(hll.isEmpty());
    assertEquals(0.0, hll.estimate());
    assertEquals(16, hll.precision());
    assertEquals(SEED, hll.seed());
  }

  @Test
  public void testRandomSeedCounts()
  {
    HyperLogLog hll = counterOf(HyperLogLog.withErrorRate(0.00408), KEYS);
    assertEquals(3L, hll.cardinality());
  }

  @Test
  public void testNewCounterIsEmpty()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(10, SEED);
    assertTrue(hll.isEmpty());
    assertEquals(0.0, hll.estimate());
    assertEquals(EstimationRegime.LINEAR_COUNTING, hll.regime());
  }

  @Test
  public void testPrecisionFromErrorRate()
  {
    assertEquals(16, HyperLogLog.precisionFor(0.00408));
    assertEquals(14, HyperLogLog.precisionFor(0.01));
    assertEquals(4, HyperLogLog.precisionFor(0.3));
    assertEquals(18, HyperLogLog.precisionFor(0.0021));
  }

  @Test
  public void testInvalidErrorRates()
  {
    for (double errorRate : new double[] {0.0, 1.0, -0.1, 1.5, Double.NaN}) {
      assertThrows(IllegalArgumentException.class, () -> HyperLogLog.withErrorRate(errorRate, SEED),
          "error rate " + errorRate);
    }
    // precision 3 and 19
    assertThrows(IllegalArgumentException.class, () -> HyperLogLog.withErrorRate(0.4, SEED));
    assertThrows(IllegalArgumentException.class, () -> HyperLogLog.withErrorRate(0.002, SEED));
  }

  @Test
  public void testPrecisionBounds()
  {
    HyperLogLog smallest = HyperLogLog.withPrecision(4, SEED);
    assertEquals(16, smallest.registerCount());
    HyperLogLog largest = HyperLogLog.withPrecision(18, SEED);
    assertEquals(1 << 18, largest.registerCount());
    assertEquals(1 << 18, largest.memoryFootprint());

    assertThrows(IllegalArgumentException.class, () -> HyperLogLog.withPrecision(3, SEED));
    assertThrows(IllegalArgumentException.class, () -> HyperLogLog.withPrecision(19, SEED));
  }

  @Test
  public void testAlpha()
  {
    assertEquals(0.673, HyperLogLog.withPrecision(4, SEED).alpha());
    assertEquals(0.697, HyperLogLog.withPrecision(5, SEED).alpha());
    assertEquals(0.709, HyperLogLog.withPrecision(6, SEED).alpha());
    assertEquals(0.7213 / (1 + 1.079 / 128), HyperLogLog.withPrecision(7, SEED).alpha());
    assertEquals(0.7213 / (1 + 1.079 / 65536), HyperLogLog.withPrecision(16, SEED).alpha());
  }

  @Test
  public void testRankOfHash()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(4, SEED);

    // nothing left after the index bits: maximum rank 65 - p
    hll.addHash(0L);
    assertEquals(61, hll.registers()[0]);

    // highest remaining bit set: rank 1
    hll.addHash(-1L);
    assertEquals(1, hll.registers()[15]);

    // only the lowest remaining bit set
    hll.addHash((1L << 4) | 3);
    assertEquals(60, hll.registers()[3]);

    // a lower rank never overwrites a higher one
    hll.addHash((1L << 63) | 3);
    assertEquals(60, hll.registers()[3]);
  }

  @Test
  public void testRegistersStayWithinBounds()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(6, SEED);
    for (long i = 0; i < 10_000; i++) {
      hll.add(i);
    }
    for (byte register : hll.registers()) {
      assertTrue(register >= 0 && register <= 65 - 6, "register " + register);
    }
  }

  @Test
  public void testDuplicatesDoNotChangeState()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(12, SEED);
    hll.add("x");
    byte[] once = hll.registers().clone();
    double estimate = hll.estimate();

    hll.add("x");
    hll.add("x");
    assertArrayEquals(once, hll.registers());
    assertEquals(estimate, hll.estimate());
  }

  @Test
  public void testRegistersNeverDecrease()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(8, SEED);
    byte[] previous = hll.registers().clone();
    for (int i = 0; i < 2_000; i++) {
      hll.add("value-" + i);
      byte[] current = hll.registers();
      for (int r = 0; r < current.length; r++) {
        assertTrue(current[r] >= previous[r], "register " + r + " decreased after value " + i);
      }
      previous = current.clone();
    }
  }

  @Test
  public void testSameSeedPlacesValuesIdentically()
  {
    HyperLogLog first = HyperLogLog.withPrecision(10, SEED);
    HyperLogLog second = HyperLogLog.withPrecision(10, HashSeed.of(SEED.k0(), SEED.k1()));
    HyperLogLog other = HyperLogLog.withPrecision(10, HashSeed.of(1L, 2L));
    for (int i = 0; i < 100; i++) {
      first.add(i);
      second.add(i);
      other.add(i);
    }
    assertArrayEquals(first.registers(), second.registers());
    assertFalse(Arrays.equals(first.registers(), other.registers()));
  }

  @Test
  public void testAddVariantsAgree()
  {
    HyperLogLog fromString = HyperLogLog.withPrecision(10, SEED);
    HyperLogLog fromBytes = HyperLogLog.withPrecision(10, SEED);
    HyperLogLog fromFunnel = HyperLogLog.withPrecision(10, SEED);
    for (String key : KEYS2) {
      fromString.add(key);
      fromBytes.add(key.getBytes(StandardCharsets.UTF_8));
      fromFunnel.add(key, Funnels.stringFunnel(StandardCharsets.UTF_8));
    }
    assertArrayEquals(fromString.registers(), fromBytes.registers());
    assertArrayEquals(fromString.registers(), fromFunnel.registers());
  }

  @Test
  public void testMerge() throws CardinalityMergeException
  {
    HyperLogLog hll = counterOf(HyperLogLog.withErrorRate(0.00408), KEYS);
    assertEquals(3L, Math.round(hll.estimate()));

    HyperLogLog hll2 = HyperLogLog.fromTemplate(hll);
    assertTrue(hll2.isEmpty());
    counterOf(hll2, KEYS2);
    assertEquals(3L, Math.round(hll2.estimate()));

    hll.merge(hll2);
    assertEquals(4L, Math.round(hll.estimate()));
    // the source is not touched
    assertEquals(3L, Math.round(hll2.estimate()));
  }

  @Test
  public void testMergeIsCommutative() throws CardinalityMergeException
  {
    HyperLogLog a = HyperLogLog.withPrecision(10, SEED);
    HyperLogLog b = HyperLogLog.fromTemplate(a);
    for (int i = 0; i < 3_000; i++) {
      a.add(i);
      b.add(i + 1_500);
    }

    HyperLogLog ab = HyperLogLog.fromTemplate(a);
    ab.merge(a);
    ab.merge(b);
    HyperLogLog ba = HyperLogLog.fromTemplate(a);
    ba.merge(b);
    ba.merge(a);

    assertArrayEquals(ab.registers(), ba.registers());
    assertEquals(ab.estimate(), ba.estimate());
  }

  @Test
  public void testMergeWithEmptyChangesNothing() throws CardinalityMergeException
  {
    HyperLogLog hll = counterOf(HyperLogLog.withPrecision(12, SEED), KEYS);
    byte[] before = hll.registers().clone();
    hll.merge(HyperLogLog.fromTemplate(hll));
    assertArrayEquals(before, hll.registers());
  }

  @Test
  public void testMergeDifferentSeedsFails()
  {
    HyperLogLog hll = counterOf(HyperLogLog.withErrorRate(0.00408, SEED), KEYS);
    HyperLogLog stranger = counterOf(HyperLogLog.withErrorRate(0.00408, HashSeed.of(42L, 42L)), KEYS2);
    byte[] before = hll.registers().clone();

    CardinalityMergeException e = assertThrows(CardinalityMergeException.class, () -> hll.merge(stranger));
    assertTrue(e.getMessage().contains("different seeds"));
    assertArrayEquals(before, hll.registers());
  }

  @Test
  public void testMergeDifferentPrecisionsFails()
  {
    HyperLogLog hll = counterOf(HyperLogLog.withPrecision(12, SEED), KEYS);
    HyperLogLog other = counterOf(HyperLogLog.withPrecision(13, SEED), KEYS2);
    byte[] before = hll.registers().clone();

    assertThrows(IllegalArgumentException.class, () -> hll.merge(other));
    assertArrayEquals(before, hll.registers());
  }

  @Test
  public void testClearKeepsParameters() throws CardinalityMergeException
  {
    HyperLogLog hll = counterOf(HyperLogLog.withPrecision(16, SEED), KEYS);
    HyperLogLog copy = HyperLogLog.fromTemplate(hll);
    hll.clear();

    assertEquals(16, hll.precision());
    assertEquals(65536, hll.registerCount());
    assertEquals(HyperLogLog.alphaFor(16), hll.alpha());
    // still mergeable with counters of the same seed
    counterOf(copy, KEYS2);
    hll.merge(copy);
    assertEquals(3L, hll.cardinality());
  }

  @Test
  public void testName()
  {
    assertEquals("hll12", HyperLogLog.withPrecision(12, SEED).name());
  }
}
