/**
 * Design and configuration identifiers and their canonical file names.
 *
 * @since 0.1.0
 */
package jp.naoj.pfs.redaction.domain.design;
