/**
 * Executor factories for redaction worker pools.
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors.</p>
 */
package jp.naoj.pfs.redaction.infrastructure.exec;
