package com.codeheadsystems.guardian.core.collaborator;

import com.codeheadsystems.guardian.core.model.AuditRecord;

/**
 * Receives audit records. Records never carry sensitive values.
 */
public interface AuditSink {

  /**
   * Records an event.
   *
   * @param record the record
   */
  void record(AuditRecord record);
}
