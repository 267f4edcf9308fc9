package io.loglog.sketch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EstimationRegimeTest
{
  private static final HashSeed SEED = HashSeed.of(7L, 11L);

  @Test
  public void testSelection()
  {
    // precision 14 : threshold 11500, 5 * m = 81920
    assertEquals(EstimationRegime.LINEAR_COUNTING, EstimationRegime.select(14, 5, 100.0, 120.0));
    assertEquals(EstimationRegime.LINEAR_COUNTING, EstimationRegime.select(14, 5, 11500.0, 12000.0));
    assertEquals(EstimationRegime.BIAS_CORRECTED, EstimationRegime.select(14, 5, 11500.5, 12000.0));
    assertEquals(EstimationRegime.BIAS_CORRECTED, EstimationRegime.select(14, 0, Double.NaN, 81920.0));
    assertEquals(EstimationRegime.RAW, EstimationRegime.select(14, 0, Double.NaN, 81920.5));
    assertEquals(EstimationRegime.RAW, EstimationRegime.select(14, 3, 90000.0, 95000.0));
  }

  @Test
  public void testFormulas()
  {
    assertEquals(42.0, EstimationRegime.LINEAR_COUNTING.estimate(10, 42.0, 50.0));
    assertEquals(50.0, EstimationRegime.RAW.estimate(10, 42.0, 50.0));
    assertEquals(
        3000.0 - HllPlusBiasTable.getEstimateBias(3000.0, 10),
        EstimationRegime.BIAS_CORRECTED.estimate(10, 42.0, 3000.0)
    );
  }

  @Test
  public void testLinearCountingState()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(4, SEED);
    hll.addHash(1L << 4);

    assertEquals(EstimationRegime.LINEAR_COUNTING, hll.regime());
    assertEquals(16 * Math.log(16 / 15.0), hll.estimate());
  }

  @Test
  public void testBiasCorrectedState()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(4, SEED);
    // rank 1 in every register
    for (long bucket = 0; bucket < 16; bucket++) {
      hll.addHash((1L << 63) | bucket);
    }

    final double raw = HyperLogLog.alphaFor(4) * 16 * 16 / 8.0;
    assertEquals(EstimationRegime.BIAS_CORRECTED, hll.regime());
    assertEquals(raw - HllPlusBiasTable.getEstimateBias(raw, 4), hll.estimate());
  }

  @Test
  public void testRawState()
  {
    HyperLogLog hll = HyperLogLog.withPrecision(4, SEED);
    // maximum rank in every register
    for (long bucket = 0; bucket < 16; bucket++) {
      hll.addHash(bucket);
    }

    final double raw = HyperLogLog.alphaFor(4) * 16 * 16 / (16.0 / (1L << 61));
    assertEquals(EstimationRegime.RAW, hll.regime());
    assertEquals(raw, hll.estimate(), raw * 1e-12);
  }
}
