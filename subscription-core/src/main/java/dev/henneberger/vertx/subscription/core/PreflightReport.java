package dev.henneberger.vertx.subscription.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    return errors().isEmpty();
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public List<PreflightIssue> errors() {
    return issues.stream()
      .filter(issue -> issue.severity() == PreflightIssue.Severity.ERROR)
      .collect(Collectors.toList());
  }

  public boolean hasIssue(String code) {
    for (PreflightIssue issue : issues) {
      if (issue.code().equals(code)) {
        return true;
      }
    }
    return false;
  }
}
