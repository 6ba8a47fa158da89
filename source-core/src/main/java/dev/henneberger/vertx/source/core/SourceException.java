package dev.henneberger.vertx.source.core;

/**
 * Base of every failure the source reports. Each carries a remediation hint for the operator.
 */
public class SourceException extends IllegalStateException {

  private final String remediation;

  public SourceException(String message, String remediation) {
    super(message);
    this.remediation = remediation;
  }

  public SourceException(String message, String remediation, Throwable cause) {
    super(message, cause);
    this.remediation = remediation;
  }

  public String remediation() {
    return remediation;
  }

  /**
   * Whether the failure may clear up by itself, so that retrying with backoff makes sense.
   */
  public boolean isTransient() {
    return false;
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    if (remediation == null || remediation.isBlank()) {
      return message;
    }
    return message + " Remediation: " + remediation;
  }
}
