/**
 * <strong>Purpose:</strong> The proposal-scoped redaction pipeline: grouping, per-proposal masking,
 * consistency checking and ordered collection of results.
 * <p><strong>Concurrency:</strong> The source configuration is shared read-only; every view is built on
 * its own deep copy, so proposals need no coordination.</p>
 * <p><strong>Observability:</strong> See {@link jp.naoj.pfs.redaction.application.redaction.RedactionEngine}
 * for metric names and MDC keys.</p>
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.application.redaction;
