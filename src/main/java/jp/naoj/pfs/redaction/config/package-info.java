/**
 * Configuration layering (embedded defaults, YAML file, {@code key=value} arguments) and the composition root
 * that turns validated configuration into wired use cases.
 */
package jp.naoj.pfs.redaction.config;
