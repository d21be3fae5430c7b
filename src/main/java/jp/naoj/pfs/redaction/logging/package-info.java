/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep secrets out of log output.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> The salted-hash secret is only ever rendered through {@link jp.naoj.pfs.redaction.logging.Logs#redact(String)}.</p>
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.logging;
