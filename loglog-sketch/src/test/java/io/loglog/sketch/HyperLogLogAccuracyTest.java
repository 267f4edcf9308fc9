package io.loglog.sketch;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Statistical checks on streams of known cardinality, crossing every estimation regime.
 */
public class HyperLogLogAccuracyTest
{
  private static final HashSeed SEED = HashSeed.of(0x9e3779b97f4a7c15L, 0xbf58476d1ce4e5b9L);

  private static double relativeError(double estimate, long cardinality)
  {
    return 100.0 * Math.abs(estimate - cardinality) / cardinality;
  }

  @Test
  public void testHighCardinalities()
  {
    // error rate 0.01 gives precision 14 : standard error ~0.8%
    HyperLogLog hll = HyperLogLog.withErrorRate(0.01, SEED);
    FastRandomIdGenerator ids = new FastRandomIdGenerator(20240501L);

    for (int card = 1; card <= 300_000; card++) {
      hll.add(ids.generate());

      if (card == 1_000) {
        assertEquals(EstimationRegime.LINEAR_COUNTING, hll.regime());
      } else if (card == 50_000) {
        assertEquals(EstimationRegime.BIAS_CORRECTED, hll.regime());
      } else if (card == 300_000) {
        assertEquals(EstimationRegime.RAW, hll.regime());
      }
      if (card % 10_000 == 0 || card == 1_000) {
        double error = relativeError(hll.estimate(), card);
        assertTrue(error < 5.0, "cardinality " + card + " error " + error + "%");
      }
    }
  }

  @Test
  public void testLowCardinalities()
  {
    // precision 10 : standard error ~3.3%
    HyperLogLog hll = HyperLogLog.withPrecision(10, SEED);
    Random random = new Random(42L);
    Set<Long> set = new HashSet<>();

    for (int card = 1; card <= 20_000; card++) {
      long value;
      do {
        value = random.nextLong();
      } while (!set.add(value));
      hll.add(value);

      if (card % 500 == 0) {
        double error = relativeError(hll.estimate(), card);
        assertTrue(error < 15.0, "cardinality " + card + " error " + error + "%");
      }
    }
  }

  @Test
  public void testMergedShardsMatchSingleEstimator() throws CardinalityMergeException
  {
    HyperLogLog whole = HyperLogLog.withPrecision(12, SEED);
    HyperLogLog[] shards = new HyperLogLog[4];
    for (int i = 0; i < shards.length; i++) {
      shards[i] = HyperLogLog.fromTemplate(whole);
    }

    FastRandomIdGenerator ids = new FastRandomIdGenerator(7L);
    for (int i = 0; i < 40_000; i++) {
      byte[] id = ids.generate();
      whole.add(id);
      shards[i % shards.length].add(id);
    }

    HyperLogLog union = HyperLogLog.fromTemplate(whole);
    for (HyperLogLog shard : shards) {
      union.merge(shard);
    }
    assertArrayEquals(whole.registers(), union.registers());
    assertEquals(whole.estimate(), union.estimate());
    assertTrue(relativeError(union.estimate(), 40_000) < 8.0);
  }
}
