package io.loglog.sketch;

import com.google.common.base.MoreObjects;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.security.SecureRandom;

/**
 * The 128-bit key of the SipHash function that places values into registers.
 *
 * <p>Two estimators fill their registers consistently only if they share the same seed,
 * so the seed doubles as the merge compatibility token.
 */
public final class HashSeed
{
  private static final SecureRandom RANDOM = new SecureRandom();

  private final long k0;
  private final long k1;

  private HashSeed(long k0, long k1)
  {
    this.k0 = k0;
    this.k1 = k1;
  }

  /**
   * @param k0 the high 64 bits of the seed
   * @param k1 the low 64 bits of the seed
   */
  public static HashSeed of(long k0, long k1)
  {
    return new HashSeed(k0, k1);
  }

  public static HashSeed random()
  {
    return new HashSeed(RANDOM.nextLong(), RANDOM.nextLong());
  }

  public long k0()
  {
    return k0;
  }

  public long k1()
  {
    return k1;
  }

  HashFunction hashFunction()
  {
    return Hashing.sipHash24(k0, k1);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HashSeed)) {
      return false;
    }
    HashSeed that = (HashSeed) o;
    return k0 == that.k0 && k1 == that.k1;
  }

  @Override
  public int hashCode()
  {
    return 31 * Long.hashCode(k0) + Long.hashCode(k1);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("k0", Long.toHexString(k0))
        .add("k1", Long.toHexString(k1))
        .toString();
  }
}
