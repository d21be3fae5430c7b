/**
 * Command-line entry points: {@code redact} writes one redacted configuration per proposal and
 * {@code proposals} lists the proposals a configuration contains.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, configure logging, invoke use cases and map
 * failures to {@link jp.naoj.pfs.redaction.api.ExitCode}s.</p>
 */
package jp.naoj.pfs.redaction.api;
