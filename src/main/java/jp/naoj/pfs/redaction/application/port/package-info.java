/**
 * <strong>Purpose:</strong> Ports between the redaction engine and its collaborators: loading, persistence,
 * metrics and per-proposal observation.
 * <p><strong>Concurrency:</strong> {@link jp.naoj.pfs.redaction.application.port.MetricsPort} and
 * {@link jp.naoj.pfs.redaction.application.port.RedactionListener} implementations are called from worker
 * threads; reader and writer only from the CLI thread.</p>
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.application.port;
