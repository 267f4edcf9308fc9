package io.loglog.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.math.DoubleMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * HyperLogLog with the empirical bias correction of HyperLogLog++
 * (http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf, https://research.google/pubs/pub40671/).
 *
 * <p>Values are hashed with SipHash-2-4 keyed by a {@link HashSeed}. The low {@code p} bits of the
 * 64-bit hash select the register, the remaining {@code 64 - p} bits give the rank.
 *
 * <p>Estimators built with the same precision and seed are mergeable; use {@link #fromTemplate(HyperLogLog)}
 * or an explicit seed to get such a pair. Instances are not thread-safe.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLog.class);

  public static final int MIN_PRECISION = HllPlusBiasTable.MIN_PRECISION;
  public static final int MAX_PRECISION = HllPlusBiasTable.MAX_PRECISION;

  private final int p;
  private final double alpha;
  private final HashSeed seed;
  private final HashFunction hashFunction;

  // each register actually only needs 6-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  HyperLogLog(int precision, HashSeed seed, byte[] registers)
  {
    checkPrecision(precision);
    Preconditions.checkArgument(
        registers.length == 1 << precision,
        "expected [%s] registers for precision [%s], got [%s]",
        1 << precision,
        precision,
        registers.length
    );
    this.p = precision;
    this.alpha = alphaFor(precision);
    this.seed = Preconditions.checkNotNull(seed, "seed");
    this.hashFunction = seed.hashFunction();
    this.registers = registers;
  }

  public static HyperLogLog withPrecision(int precision, HashSeed seed)
  {
    checkPrecision(precision);
    return new HyperLogLog(precision, seed, new byte[1 << precision]);
  }

  /**
   * Creates an estimator whose standard error is about {@code errorRate}.
   *
   * @throws IllegalArgumentException if {@code errorRate} is not in (0, 1) or needs a precision outside [4, 18]
   */
  public static HyperLogLog withErrorRate(double errorRate, HashSeed seed)
  {
    final int precision = precisionFor(errorRate);
    LOG.debug("Error rate [{}] gives precision [{}] with [{}] registers", errorRate, precision, 1 << precision);
    return withPrecision(precision, seed);
  }

  /**
   * Same as {@link #withErrorRate(double, HashSeed)} with a random seed. The result can only be merged
   * with estimators derived from it through {@link #fromTemplate(HyperLogLog)}.
   */
  public static HyperLogLog withErrorRate(double errorRate)
  {
    return withErrorRate(errorRate, HashSeed.random());
  }

  /**
   * Returns an empty estimator with the parameters and seed of {@code template}.
   */
  public static HyperLogLog fromTemplate(HyperLogLog template)
  {
    return withPrecision(template.p, template.seed);
  }

  static int precisionFor(double errorRate)
  {
    Preconditions.checkArgument(
        errorRate > 0.0 && errorRate < 1.0,
        "invalid error rate [%s] : should be in (0, 1)",
        errorRate
    );
    // log2((1.04 / e)^2)
    final double precision = Math.ceil(2.0 * DoubleMath.log2(1.04 / errorRate));
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "error rate [%s] needs precision [%s] : should be in [%s, %s]",
        errorRate,
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    return (int) precision;
  }

  static double alphaFor(int p)
  {
    switch (p) {
      case 4:
        return 0.673;
      case 5:
        return 0.697;
      case 6:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / (1 << p));
    }
  }

  private static void checkPrecision(int precision)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
  }

  @Override
  public void add(byte[] value)
  {
    addHash(hashFunction.hashBytes(value).asLong());
  }

  @Override
  public void add(long value)
  {
    addHash(hashFunction.hashLong(value).asLong());
  }

  @Override
  public void add(CharSequence value)
  {
    addHash(hashFunction.hashString(value, StandardCharsets.UTF_8).asLong());
  }

  @Override
  public <V> void add(V value, Funnel<? super V> funnel)
  {
    addHash(hashFunction.hashObject(value, funnel).asLong());
  }

  /**
   * Adds an already hashed value. The hash must be uniformly distributed over all 64 bits.
   */
  public void addHash(long hash)
  {
    final int bucket = (int) (hash & (registers.length - 1));
    // rank = (64 - p) - bitLength(hash >>> p) + 1, which is 65 - p when no bit is left
    final int rank = Long.numberOfLeadingZeros(hash >>> p) - p + 1;
    Preconditions.checkState(rank > 0, "non-positive rank [%s] for hash [%s]", rank, hash);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[bucket] < rank) {
      registers[bucket] = (byte) rank;
    }
  }

  /**
   * Folds {@code that} into this estimator, which afterwards estimates the cardinality of the union.
   *
   * @throws IllegalArgumentException if the precisions differ
   * @throws CardinalityMergeException if the seeds differ; this estimator is left unchanged
   */
  @Override
  public void merge(HyperLogLog that) throws CardinalityMergeException
  {
    Preconditions.checkArgument(
        this.p == that.p && this.registers.length == that.registers.length,
        "cannot merge precision [%s] into precision [%s]",
        that.p,
        this.p
    );
    if (!this.seed.equals(that.seed)) {
      throw new CardinalityMergeException(String.format(
          "cannot merge estimators hashed with different seeds (%s, %s) : "
          + "create both with the same seed or through fromTemplate()",
          this.seed,
          that.seed
      ));
    }
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  @Override
  public double estimate()
  {
    final Summary summary = summarize();
    return summary.regime().estimate(p, summary.linearEstimate, summary.rawEstimate);
  }

  /**
   * Returns the formula {@link #estimate()} currently uses.
   */
  public EstimationRegime regime()
  {
    return summarize().regime();
  }

  private Summary summarize()
  {
    final int m = registers.length;

    double registerSum = 0.0;
    int zeros = 0;
    for (int i = 0; i < m; i++) {
      registerSum += 1.0 / (1L << registers[i]);
      if (registers[i] == 0) {
        zeros++;
      }
    }

    final double linearEstimate = zeros > 0 ? m * Math.log(m / (double) zeros) : Double.NaN;
    return new Summary(zeros, linearEstimate, alpha * m * m / registerSum);
  }

  @Override
  public boolean isEmpty()
  {
    return estimate() == 0.0;
  }

  @Override
  public void clear()
  {
    Arrays.fill(registers, (byte) 0);
  }

  public int precision()
  {
    return p;
  }

  public double alpha()
  {
    return alpha;
  }

  public int registerCount()
  {
    return registers.length;
  }

  public HashSeed seed()
  {
    return seed;
  }

  // live view, callers must not modify it
  byte[] registers()
  {
    return registers;
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `p`, `alpha`, `seed` and `hashFunction`
  }

  @Override
  public String name()
  {
    return "hll" + p;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("precision", p)
        .add("registers", registers.length)
        .add("seed", seed)
        .toString();
  }

  private final class Summary
  {
    final int zeros;
    final double linearEstimate;
    final double rawEstimate;

    Summary(int zeros, double linearEstimate, double rawEstimate)
    {
      this.zeros = zeros;
      this.linearEstimate = linearEstimate;
      this.rawEstimate = rawEstimate;
    }

    EstimationRegime regime()
    {
      return EstimationRegime.select(p, zeros, linearEstimate, rawEstimate);
    }
  }
}
