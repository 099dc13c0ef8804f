package com.flamingo.ai.digest.service.enrichment;

/** Scales an enrichment importance score by the weight of the message's channel. */
final class ImportanceWeighting {

  static final double MIN_CHANNEL_WEIGHT = 0.1;
  static final double MAX_CHANNEL_WEIGHT = 2.0;
  static final double DEFAULT_CHANNEL_WEIGHT = 1.0;

  private static final double MAX_IMPORTANCE = 1.0;

  private ImportanceWeighting() {}

  /**
   * Weights below {@link #MIN_CHANNEL_WEIGHT} count as unset and fall back to the default; weights
   * above {@link #MAX_CHANNEL_WEIGHT} are capped. The result never exceeds 1.0.
   */
  static double apply(double importance, double channelWeight) {
    double weight = channelWeight;
    if (Double.isNaN(weight) || weight < MIN_CHANNEL_WEIGHT) {
      weight = DEFAULT_CHANNEL_WEIGHT;
    } else if (weight > MAX_CHANNEL_WEIGHT) {
      weight = MAX_CHANNEL_WEIGHT;
    }
    return Math.min(importance * weight, MAX_IMPORTANCE);
  }
}
