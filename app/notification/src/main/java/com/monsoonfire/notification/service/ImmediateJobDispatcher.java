/*
 * Where: Notification service layer
 * What: Best-effort processing attempt right after a job is created
 * Why: Users should not wait for the next poll; the attempt runs only after the creating
 *      transaction commits so the worker can see the row
 */
package com.monsoonfire.notification.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Component
public class ImmediateJobDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ImmediateJobDispatcher.class);

  private final TaskExecutor executor;
  private final ObjectProvider<NotificationJobProcessor> processorProvider;

  public ImmediateJobDispatcher(
      @Qualifier("jobDispatchExecutor") TaskExecutor executor,
      ObjectProvider<NotificationJobProcessor> processorProvider) {
    this.executor = executor;
    this.processorProvider = processorProvider;
  }

  public void dispatchAfterCommit(String jobId) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              submit(jobId);
            }
          });
      return;
    }
    submit(jobId);
  }

  private void submit(String jobId) {
    try {
      executor.execute(() -> runSafely(jobId));
    } catch (TaskRejectedException ex) {
      // the periodic sweep picks the job up
      logger.warn("immediate dispatch rejected jobId={}", jobId, ex);
    }
  }

  private void runSafely(String jobId) {
    try {
      processorProvider.getObject().processJob(jobId);
    } catch (RuntimeException ex) {
      logger.error("immediate dispatch failed jobId={}", jobId, ex);
    }
  }
}
