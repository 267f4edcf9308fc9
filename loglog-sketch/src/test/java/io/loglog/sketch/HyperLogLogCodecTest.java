package io.loglog.sketch;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class HyperLogLogCodecTest
{
  private static final HashSeed SEED = HashSeed.of(0x5eedL, -3L);

  private static HyperLogLog filled(int precision, int count)
  {
    HyperLogLog hll = HyperLogLog.withPrecision(precision, SEED);
    for (int i = 0; i < count; i++) {
      hll.add("item-" + i);
    }
    return hll;
  }

  @Test
  public void testRoundTrip() throws CardinalityMergeException
  {
    HyperLogLog hll = filled(12, 10_000);
    byte[] bytes = HyperLogLogCodec.toBytes(hll);
    assertEquals(HyperLogLogCodec.HEADER_SIZE + 4096, bytes.length);

    HyperLogLog decoded = HyperLogLogCodec.fromBytes(bytes);
    assertEquals(hll.estimate(), decoded.estimate());
    assertEquals(hll.precision(), decoded.precision());
    assertEquals(hll.alpha(), decoded.alpha());
    assertEquals(hll.seed(), decoded.seed());
    assertArrayEquals(hll.registers(), decoded.registers());

    // decoded estimator places values like the encoded one
    double before = decoded.estimate();
    decoded.merge(hll);
    assertEquals(before, decoded.estimate());
    decoded.add("item-42");
    assertArrayEquals(hll.registers(), decoded.registers());
  }

  @Test
  public void testRoundTripOfEmptyEstimator()
  {
    HyperLogLog decoded = HyperLogLogCodec.fromBytes(HyperLogLogCodec.toBytes(HyperLogLog.withPrecision(4, SEED)));
    assertTrue(decoded.isEmpty());
    assertEquals(16, decoded.registerCount());
  }

  @Test
  public void testDecodedRegistersAreNotShared()
  {
    HyperLogLog hll = filled(8, 100);
    byte[] bytes = HyperLogLogCodec.toBytes(hll);
    HyperLogLog decoded = HyperLogLogCodec.fromBytes(bytes);
    decoded.clear();

    assertFalse(hll.isEmpty());
    assertTrue(decoded.isEmpty());
  }

  @Test
  public void testMalformedInput()
  {
    byte[] valid = HyperLogLogCodec.toBytes(filled(6, 200));

    assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(new byte[3]));
    assertThrows(
        IllegalArgumentException.class,
        () -> HyperLogLogCodec.fromBytes(Arrays.copyOf(valid, valid.length - 1))
    );

    byte[] badVersion = valid.clone();
    badVersion[0] = 9;
    assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(badVersion));

    byte[] badPrecision = valid.clone();
    badPrecision[1] = 19;
    assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(badPrecision));

    byte[] badAlpha = valid.clone();
    badAlpha[2] ^= 0x01;
    assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(badAlpha));

    byte[] badRegister = valid.clone();
    badRegister[HyperLogLogCodec.HEADER_SIZE] = 60; // at most 65 - 6
    assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(badRegister));
  }

  @Test
  public void testAlphaMismatchIsReported()
  {
    byte[] bytes = HyperLogLogCodec.toBytes(filled(10, 50));
    ByteBuffer.wrap(bytes).putDouble(2, 0.7);

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> HyperLogLogCodec.fromBytes(bytes));
    assertEquals("alpha [0.7] does not match precision [10]", e.getMessage());
  }
}
