package com.codeheadsystems.guardian.core.audit;

import com.codeheadsystems.guardian.core.collaborator.AuditSink;
import com.codeheadsystems.guardian.core.model.AuditRecord;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit records as key=value lines to the {@code guardian.audit} logger.
 */
@Singleton
public class LoggingAuditSink implements AuditSink {

  private static final Logger audit = LoggerFactory.getLogger("guardian.audit");

  @Override
  public void record(final AuditRecord record) {
    audit.info("event={} target={} platform={} status={} message={}",
        record.eventType(), record.targetName(), record.platform(), record.status(),
        Redactor.redact(record.message()));
  }
}
