package io.intellixity.collate.aggregation;

/**
 * An as-of date and interval would need rows older than the configured input floor, so the
 * window would be silently truncated.
 */
public final class TemporalValidationException extends RuntimeException {
  private final String date;
  private final String interval;
  private final String inputMinDate;

  public TemporalValidationException(String date, String interval, String inputMinDate) {
    super("date '" + date + "' - '" + interval + "' is before input_min_date ('" + inputMinDate + "')");
    this.date = date;
    this.interval = interval;
    this.inputMinDate = inputMinDate;
  }

  public String date() { return date; }
  public String interval() { return interval; }
  public String inputMinDate() { return inputMinDate; }
}
