/**
 * <strong>Purpose:</strong> JSON storage for configurations and redacted views, built on Jackson's streaming API.
 * <p><strong>Concurrency:</strong> Reader and writer are used from the CLI thread; the writer serializes calls.</p>
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.infrastructure.persistence.json;
