package io.loglog.sketch;

/**
 * The three formulas a {@link HyperLogLog} chooses from, depending on how full its registers are.
 */
public enum EstimationRegime
{
  /**
   * Some registers are still empty and the linear counting estimate is within the
   * precision's threshold.
   */
  LINEAR_COUNTING {
    @Override
    double estimate(int p, double linearEstimate, double rawEstimate)
    {
      return linearEstimate;
    }
  },

  /**
   * The raw estimate is at most {@code 5 * m}: subtract the empirical bias.
   */
  BIAS_CORRECTED {
    @Override
    double estimate(int p, double linearEstimate, double rawEstimate)
    {
      return rawEstimate - HllPlusBiasTable.getEstimateBias(rawEstimate, p);
    }
  },

  /**
   * Large cardinalities, where the raw harmonic mean estimate is used as is.
   */
  RAW {
    @Override
    double estimate(int p, double linearEstimate, double rawEstimate)
    {
      return rawEstimate;
    }
  };

  abstract double estimate(int p, double linearEstimate, double rawEstimate);

  /**
   * @param zeros number of registers still at zero
   * @param linearEstimate {@code m * ln(m / zeros)}, ignored when {@code zeros == 0}
   * @param rawEstimate {@code alpha * m^2 / sum(2^-register)}
   */
  static EstimationRegime select(int p, int zeros, double linearEstimate, double rawEstimate)
  {
    if (zeros > 0 && linearEstimate <= HllPlusBiasTable.getThreshold(p)) {
      return LINEAR_COUNTING;
    }
    if (rawEstimate <= 5.0 * (1 << p)) {
      return BIAS_CORRECTED;
    }
    return RAW;
  }
}
