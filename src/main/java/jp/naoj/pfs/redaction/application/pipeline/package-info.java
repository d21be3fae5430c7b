/**
 * Use cases driven by the command line: redacting a configuration into per-proposal files and listing the
 * proposals it contains.
 */
package jp.naoj.pfs.redaction.application.pipeline;
