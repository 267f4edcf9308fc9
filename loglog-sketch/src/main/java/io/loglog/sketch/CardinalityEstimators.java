package io.loglog.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds estimators from a textual configuration.
 *
 * <ul>
 *   <li>{@code hll} : precision 14
 *   <li>{@code hll<precision>} : e.g. {@code hll12}
 *   <li>{@code hll@<errorRate>} : e.g. {@code hll@0.01}
 * </ul>
 *
 * <p>Any of them may end with {@code #<k0>:<k1>}, two hexadecimal seed keys, e.g. {@code hll12#1f:2a}.
 * Without it a random seed is drawn.
 */
public final class CardinalityEstimators
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimators.class);

  static final int DEFAULT_PRECISION = 14;
  private static final String PREFIX = "hll";

  private CardinalityEstimators()
  {
  }

  public static HyperLogLog get(String name)
  {
    return parse(name).create(HashSeed.random());
  }

  /**
   * Unlike {@link #get(String)}, the configuration is parsed once and a random seed, if needed, is drawn
   * once, so all supplied estimators are mergeable with each other.
   */
  public static Supplier<HyperLogLog> lazyGet(String name)
  {
    final Config config = parse(name);
    final HashSeed fallback = HashSeed.random();
    return () -> config.create(fallback);
  }

  static Config parse(String name)
  {
    if (!name.startsWith(PREFIX)) {
      throw new IllegalArgumentException("Unknown estimator : " + name);
    }

    String rest = name.substring(PREFIX.length());
    HashSeed seed = null;
    final int seedStart = rest.indexOf('#');
    if (seedStart >= 0) {
      seed = parseSeed(name, rest.substring(seedStart + 1));
      rest = rest.substring(0, seedStart);
    }

    final int precision;
    try {
      if (rest.isEmpty()) {
        precision = DEFAULT_PRECISION;
      } else if (rest.startsWith("@")) {
        precision = HyperLogLog.precisionFor(Double.parseDouble(rest.substring(1)));
      } else {
        precision = Integer.parseInt(rest);
      }
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
    Preconditions.checkArgument(
        precision >= HyperLogLog.MIN_PRECISION && precision <= HyperLogLog.MAX_PRECISION,
        "invalid precision [%s] in estimator [%s]",
        precision,
        name
    );
    LOG.debug("Resolved estimator [{}] to precision [{}]", name, precision);
    return new Config(precision, seed);
  }

  private static HashSeed parseSeed(String name, String keys)
  {
    final int colon = keys.indexOf(':');
    Preconditions.checkArgument(colon > 0, "seed of [%s] should be <k0>:<k1>", name);
    try {
      return HashSeed.of(
          Long.parseUnsignedLong(keys.substring(0, colon), 16),
          Long.parseUnsignedLong(keys.substring(colon + 1), 16)
      );
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid seed in estimator : " + name, e);
    }
  }

  static final class Config
  {
    final int precision;
    final HashSeed seed;

    Config(int precision, HashSeed seed)
    {
      this.precision = precision;
      this.seed = seed;
    }

    // `fallback` is used when the configuration names no seed
    HyperLogLog create(HashSeed fallback)
    {
      return HyperLogLog.withPrecision(precision, seed != null ? seed : fallback);
    }
  }
}
