/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No logging; failures surface via {@link IllegalArgumentException}.</p>
 * <p><strong>Security:</strong> Restricts tokens that become file names so a proposal id cannot escape the
 * output directory.</p>
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.validation;
