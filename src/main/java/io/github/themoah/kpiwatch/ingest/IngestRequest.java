package io.github.themoah.kpiwatch.ingest;

import io.github.themoah.kpiwatch.ingest.IngestionException.Kind;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * A validated ingestion record.
 *
 * <p>Expected JSON:
 * <pre>
 * {"metric_name": "inventory_level", "timestamp": "2024-06-01T12:34:56", "value": 123.45}
 * </pre>
 * {@code kpi_name} is accepted in place of {@code metric_name}. Timestamps without an
 * offset are taken as UTC.
 *
 * @param metricName the metric name
 * @param timestamp the parsed observation time
 * @param value the observed value, always finite
 */
public record IngestRequest(
  String metricName,
  Instant timestamp,
  double value
) {

  static final String FIELD_METRIC_NAME = "metric_name";
  static final String FIELD_LEGACY_NAME = "kpi_name";
  static final String FIELD_TIMESTAMP = "timestamp";
  static final String FIELD_VALUE = "value";

  private static final int ISO_DATE_LENGTH = "yyyy-MM-dd".length();

  /**
   * Parses a raw request body.
   *
   * @param body the request body, may be null
   * @return the validated request
   * @throws IngestionException if the body is missing, not a JSON object or fails validation
   */
  public static IngestRequest parse(Buffer body) {
    if (body == null || body.length() == 0 || body.toString().isBlank()) {
      throw new IngestionException(Kind.MISSING_BODY, "Missing JSON body");
    }
    JsonObject json;
    try {
      json = new JsonObject(body);
    } catch (DecodeException e) {
      throw new IngestionException(Kind.INVALID_PAYLOAD, "Invalid payload: body must be a JSON object");
    }
    return fromJson(json);
  }

  /**
   * Validates field presence and types.
   *
   * @throws IngestionException on the first invalid field
   */
  public static IngestRequest fromJson(JsonObject json) {
    if (json == null) {
      throw new IngestionException(Kind.MISSING_BODY, "Missing JSON body");
    }

    Object name = json.containsKey(FIELD_METRIC_NAME) ? json.getValue(FIELD_METRIC_NAME) : json.getValue(FIELD_LEGACY_NAME);
    if (!(name instanceof String metricName) || metricName.isBlank()) {
      throw new IngestionException(Kind.INVALID_PAYLOAD,
        "Invalid payload: '" + FIELD_METRIC_NAME + "' must be a non-empty string");
    }

    Object rawTimestamp = json.getValue(FIELD_TIMESTAMP);
    if (!(rawTimestamp instanceof String timestampText)) {
      throw new IngestionException(Kind.INVALID_PAYLOAD,
        "Invalid payload: '" + FIELD_TIMESTAMP + "' must be an ISO-8601 string");
    }

    Object rawValue = json.getValue(FIELD_VALUE);
    if (!(rawValue instanceof Number number)) {
      throw new IngestionException(Kind.INVALID_PAYLOAD,
        "Invalid payload: '" + FIELD_VALUE + "' must be a number");
    }
    double value = number.doubleValue();
    if (!Double.isFinite(value)) {
      throw new IngestionException(Kind.INVALID_VALUE,
        "Invalid value: '" + FIELD_VALUE + "' must be finite");
    }

    return new IngestRequest(metricName, parseTimestamp(timestampText), value);
  }

  /**
   * Parses an ISO-8601 date-time, local date-time (UTC) or date (midnight UTC).
   * The date and time may be separated by a space instead of 'T'.
   *
   * @throws IngestionException if the text matches none of them
   */
  static Instant parseTimestamp(String text) {
    String trimmed = text.trim();
    if (trimmed.length() > ISO_DATE_LENGTH && trimmed.charAt(ISO_DATE_LENGTH) == ' ') {
      // "2024-06-01 12:34:56" is accepted as well as the 'T' separator
      trimmed = trimmed.substring(0, ISO_DATE_LENGTH) + 'T' + trimmed.substring(ISO_DATE_LENGTH + 1);
    }
    try {
      if (trimmed.length() == ISO_DATE_LENGTH) {
        return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
        trimmed, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return zoned.toInstant();
      }
      return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new IngestionException(Kind.INVALID_TIMESTAMP, "Invalid timestamp format");
    }
  }
}
