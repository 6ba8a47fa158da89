package dev.henneberger.vertx.source.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PreflightReportsTest {

  @Test
  void describesErrorsAndWarningsSeparately() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error("WAL_LEVEL_INVALID", "wal_level is 'replica'", "Set wal_level=logical."),
      PreflightIssue.warning("SLOT_LAG_HIGH", "lag is high", null)));

    assertEquals("Preflight failed: [WAL_LEVEL_INVALID] wal_level is 'replica' Remediation: Set wal_level=logical.",
      PreflightReports.describeFailure(report));
    assertEquals("[SLOT_LAG_HIGH] lag is high", PreflightReports.describeWarnings(report));
  }

  @Test
  void failedReportRaisesConfigException() {
    PreflightReport report = new PreflightReport(List.of(
      PreflightIssue.error("CONNECTION_FAILED", "refused", "Check host.")));

    ConfigException error = assertThrows(ConfigException.class, report::throwIfFailed);
    assertSame(report, error.report());
    assertTrue(PreflightReport.ok().isOk());
  }
}
