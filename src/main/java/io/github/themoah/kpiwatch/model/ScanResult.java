package io.github.themoah.kpiwatch.model;

/**
 * Outcome of one monitor pass over all known metrics.
 */
public record ScanResult(
  int metricsScanned,
  int alertsRaised,
  int evaluationFailures,  // metrics skipped because evaluation threw
  int sinkFailures         // alerts the notification sink failed to deliver
) {}
