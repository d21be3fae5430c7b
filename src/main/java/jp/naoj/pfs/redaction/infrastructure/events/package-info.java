/**
 * Listeners that observe per-proposal redaction outcomes.
 */
package jp.naoj.pfs.redaction.infrastructure.events;
