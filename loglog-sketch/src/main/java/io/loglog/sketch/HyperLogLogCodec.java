package io.loglog.sketch;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;

/**
 * Binary form of a {@link HyperLogLog}.
 *
 * <pre>
 * version:1 | precision:1 | alpha:8 | registerCount:4 | k0:8 | k1:8 | registers:registerCount
 * </pre>
 *
 * <p>All multi-byte fields are big-endian. Alpha and the register count are redundant with the
 * precision and are checked against it on decode.
 */
public final class HyperLogLogCodec
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLogCodec.class);

  static final byte VERSION = 1;
  static final int HEADER_SIZE = 1 + 1 + Double.BYTES + Integer.BYTES + 2 * Long.BYTES;

  private HyperLogLogCodec()
  {
  }

  public static byte[] toBytes(HyperLogLog hll)
  {
    final byte[] registers = hll.registers();
    final ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + registers.length);
    buffer.put(VERSION);
    buffer.put((byte) hll.precision());
    buffer.putDouble(hll.alpha());
    buffer.putInt(registers.length);
    buffer.putLong(hll.seed().k0());
    buffer.putLong(hll.seed().k1());
    buffer.put(registers);
    return buffer.array();
  }

  /**
   * @throws IllegalArgumentException if {@code bytes} is not a well-formed serialized estimator
   */
  public static HyperLogLog fromBytes(byte[] bytes)
  {
    Preconditions.checkArgument(bytes.length >= HEADER_SIZE, "truncated header : [%s] bytes", bytes.length);
    final ByteBuffer buffer = ByteBuffer.wrap(bytes);

    final byte version = buffer.get();
    Preconditions.checkArgument(version == VERSION, "unsupported version [%s]", version);

    final int p = buffer.get();
    Preconditions.checkArgument(
        p >= HyperLogLog.MIN_PRECISION && p <= HyperLogLog.MAX_PRECISION,
        "invalid precision [%s]",
        p
    );
    final double alpha = buffer.getDouble();
    Preconditions.checkArgument(
        Double.compare(alpha, HyperLogLog.alphaFor(p)) == 0,
        "alpha [%s] does not match precision [%s]",
        Double.valueOf(alpha),
        p
    );
    final int registerCount = buffer.getInt();
    Preconditions.checkArgument(
        registerCount == 1 << p,
        "register count [%s] does not match precision [%s]",
        registerCount,
        p
    );
    final HashSeed seed = HashSeed.of(buffer.getLong(), buffer.getLong());
    Preconditions.checkArgument(
        buffer.remaining() == registerCount,
        "expected [%s] register bytes, got [%s]",
        registerCount,
        buffer.remaining()
    );

    final byte[] registers = new byte[registerCount];
    buffer.get(registers);
    final int maxRank = Long.SIZE + 1 - p;
    for (int i = 0; i < registers.length; i++) {
      Preconditions.checkArgument(
          registers[i] >= 0 && registers[i] <= maxRank,
          "register [%s] holds [%s] : should be in [0, %s]",
          i,
          registers[i],
          maxRank
      );
    }

    LOG.debug("Decoded estimator with precision [{}] from [{}] bytes", p, bytes.length);
    return new HyperLogLog(p, seed, registers);
  }
}
