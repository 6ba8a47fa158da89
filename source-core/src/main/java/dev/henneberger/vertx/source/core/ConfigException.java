package dev.henneberger.vertx.source.core;

/**
 * Missing or mismatched slot, publication or stream configuration. Raised before a sync starts.
 */
public class ConfigException extends SourceException {

  private final PreflightReport report;

  public ConfigException(String message, String remediation) {
    super(message, remediation);
    this.report = null;
  }

  public ConfigException(PreflightReport report) {
    super(PreflightReports.describeFailure(report), null);
    this.report = report;
  }

  /**
   * The failed preflight report, when the error came from a preflight run.
   */
  public PreflightReport report() {
    return report;
  }
}
