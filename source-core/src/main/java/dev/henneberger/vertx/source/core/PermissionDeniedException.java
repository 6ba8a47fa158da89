package dev.henneberger.vertx.source.core;

/**
 * The connector lacks the rights to make a table replicable (for example to set its replica
 * identity).
 */
public class PermissionDeniedException extends SourceException {

  public PermissionDeniedException(String message, String remediation) {
    super(message, remediation);
  }

  public PermissionDeniedException(String message, String remediation, Throwable cause) {
    super(message, remediation, cause);
  }
}
