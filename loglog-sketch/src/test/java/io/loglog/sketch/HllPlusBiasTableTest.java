package io.loglog.sketch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HllPlusBiasTableTest
{
  private static double meanBias(int p, int start)
  {
    double sum = 0.0;
    for (int i = start; i < start + 6; i++) {
      sum += HllPlusBiasTable.biasData[p - 4][i];
    }
    return sum / 6;
  }

  @Test
  public void testTablesShape()
  {
    assertEquals(15, HllPlusBiasTable.thresholdData.length);
    assertEquals(15, HllPlusBiasTable.rawEstimateData.length);
    assertEquals(15, HllPlusBiasTable.biasData.length);
    for (int i = 0; i < 15; i++) {
      assertEquals(HllPlusBiasTable.rawEstimateData[i].length, HllPlusBiasTable.biasData[i].length);
      assertTrue(HllPlusBiasTable.rawEstimateData[i].length >= HllPlusBiasTable.NEIGHBORS);
    }
    assertEquals(10.0, HllPlusBiasTable.getThreshold(4));
    assertEquals(350000.0, HllPlusBiasTable.getThreshold(18));
  }

  @Test
  public void testBelowFirstPoint()
  {
    for (int p = 4; p <= 18; p++) {
      double first = HllPlusBiasTable.rawEstimateData[p - 4][0];
      assertEquals(0, HllPlusBiasTable.nearestNeighborsStart(first / 2, p));
      assertEquals(0, HllPlusBiasTable.nearestNeighborsStart(first, p));
      assertEquals(meanBias(p, 0), HllPlusBiasTable.getEstimateBias(first / 2, p));
    }
  }

  @Test
  public void testAboveLastPoint()
  {
    for (int p = 4; p <= 18; p++) {
      double[] points = HllPlusBiasTable.rawEstimateData[p - 4];
      int lastWindow = points.length - 6;
      double last = points[points.length - 1];
      assertEquals(lastWindow, HllPlusBiasTable.nearestNeighborsStart(last, p));
      assertEquals(lastWindow, HllPlusBiasTable.nearestNeighborsStart(last * 2, p));
      assertEquals(meanBias(p, lastWindow), HllPlusBiasTable.getEstimateBias(last * 2, p));
    }
  }

  @Test
  public void testWindowInTheMiddle()
  {
    // neighbours of 30.0 : 27.7602, 28.4814, 29.433, 30.2926, 31.0664, 31.9996
    assertEquals(25, HllPlusBiasTable.nearestNeighborsStart(30.0, 4));
    assertEquals(meanBias(4, 25), HllPlusBiasTable.getEstimateBias(30.0, 4));
  }

  @Test
  public void testEquidistantEndsDropTheRightEnd()
  {
    double[] points = HllPlusBiasTable.rawEstimateData[0];

    // 14.4753 lies exactly halfway between points[3] and points[9], the last two candidates
    double estimate = (points[3] + points[9]) / 2;
    assertEquals(2.0 * estimate - points[3], points[9]);
    assertEquals(3, HllPlusBiasTable.nearestNeighborsStart(estimate, 4));
    assertEquals(meanBias(4, 3), HllPlusBiasTable.getEstimateBias(estimate, 4));

    estimate = (points[24] + points[30]) / 2;
    assertEquals(2.0 * estimate - points[24], points[30]);
    assertEquals(24, HllPlusBiasTable.nearestNeighborsStart(estimate, 4));
  }

  @Test
  public void testPartitionPointOnOutOfOrderPoints()
  {
    double[] points = HllPlusBiasTable.rawEstimateData[6 - 4];
    // points[148] = 238.1974 is followed by the smaller points[149] = 237.7474
    assertTrue(points[148] > points[149]);
    assertEquals(150, HllPlusBiasTable.partitionPoint(points, 238.0));
    assertEquals(150, HllPlusBiasTable.partitionPoint(points, 238.1974));
    assertEquals(148, HllPlusBiasTable.partitionPoint(points, 237.7474));
    assertEquals(146, HllPlusBiasTable.nearestNeighborsStart(238.0, 6));
  }

  @Test
  public void testWindowContainsExactMatch()
  {
    // points are strictly ascending from precision 7 on
    for (int p = 7; p <= 18; p++) {
      double[] points = HllPlusBiasTable.rawEstimateData[p - 4];
      for (int i = 0; i < points.length; i++) {
        int start = HllPlusBiasTable.nearestNeighborsStart(points[i], p);
        assertTrue(start >= 0 && start <= points.length - 6, "p " + p + " point " + i);
        assertTrue(start <= i && i < start + 6, "p " + p + " point " + i + " start " + start);
      }
    }
  }

  @Test
  public void testLookupIsReproducible()
  {
    for (int p = 4; p <= 18; p++) {
      double[] points = HllPlusBiasTable.rawEstimateData[p - 4];
      for (int i = 1; i < points.length; i++) {
        double between = (points[i - 1] + points[i]) / 2;
        double bias = HllPlusBiasTable.getEstimateBias(between, p);
        assertEquals(bias, HllPlusBiasTable.getEstimateBias(between, p));
        assertEquals(meanBias(p, HllPlusBiasTable.nearestNeighborsStart(between, p)), bias);
      }
    }
  }

  @Test
  public void testUnknownPrecision()
  {
    assertThrows(IllegalArgumentException.class, () -> HllPlusBiasTable.nearestNeighborsStart(10.0, 3));
    assertThrows(IllegalArgumentException.class, () -> HllPlusBiasTable.getThreshold(19));
  }
}
