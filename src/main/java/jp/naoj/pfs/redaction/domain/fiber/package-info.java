/**
 * <strong>Purpose:</strong> Fiber-table domain model: rows, header metadata and target classification.
 * <p><strong>Pipeline role:</strong> Input and output shape of the redaction engine.
 * <p><strong>Concurrency:</strong> All types are immutable and may be shared between workers.
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.domain.fiber;
