package io.loglog.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;

/**
 * A reproducible id generator: SHA-256 over a counter and a fixed seed.
 *
 * <p>Ids never repeat, so the number of generated ids is the exact cardinality of the stream.
 */
public class FastRandomIdGenerator
{
  private final HashFunction sha256 = Hashing.sha256();
  private final ByteBuffer buffer;
  private long counter = 0;

  public FastRandomIdGenerator(long seed)
  {
    buffer = ByteBuffer.allocate(16);
    buffer.putLong(8, seed);
  }

  /**
   * @return a 32 bytes id
   */
  public byte[] generate()
  {
    buffer.putLong(0, counter++);
    return sha256.hashBytes(buffer.array()).asBytes();
  }
}
