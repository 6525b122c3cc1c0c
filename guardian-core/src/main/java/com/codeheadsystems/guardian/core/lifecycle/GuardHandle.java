package com.codeheadsystems.guardian.core.lifecycle;

/**
 * Accounting handle for a tracked value. It cannot be used to read the value back.
 *
 * @param id    sequence number within one guard
 * @param label non-sensitive description, e.g. {@code artifact:session_id}
 */
public record GuardHandle(long id, String label) {
}
