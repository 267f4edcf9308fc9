package io.loglog.sketch;

/**
 * Thrown when two estimators are structurally alike but cannot be merged because
 * their registers were filled through different hash functions.
 */
public class CardinalityMergeException extends Exception
{
  public CardinalityMergeException(String message)
  {
    super(message);
  }
}
