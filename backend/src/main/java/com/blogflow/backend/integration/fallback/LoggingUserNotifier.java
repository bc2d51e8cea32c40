package com.blogflow.backend.integration.fallback;

import com.blogflow.backend.capability.UserNotifier;
import com.blogflow.backend.capability.model.WorkflowOutcome;
import com.blogflow.backend.integration.OutcomeMessageFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "app.telegram",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LoggingUserNotifier implements UserNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingUserNotifier.class);

  @Override
  public void notify(WorkflowOutcome outcome) {
    log.info(
        "Workflow {} outcome for user {}:\n{}",
        outcome.workflowId(),
        outcome.userId(),
        OutcomeMessageFormatter.format(outcome));
  }
}
