package io.loglog.sketch;

import com.google.common.hash.Funnel;

public interface CardinalityEstimator<T>
{
  void add(byte[] value);
  void add(long value);
  void add(CharSequence value);
  <V> void add(V value, Funnel<? super V> funnel);

  void merge(T that) throws CardinalityMergeException;
  double estimate();
  boolean isEmpty();
  void clear();

  default long cardinality()
  {
    return Math.round(estimate());
  }

  long memoryFootprint();

  String name();
}
