/**
 * Masking rules: which rows are obscured for a proposal, which columns are overwritten, and how
 * the replacement object identifier is derived. Also holds the redaction error types.
 */
package jp.naoj.pfs.redaction.domain.redaction;
