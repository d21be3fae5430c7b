package jp.naoj.pfs.redaction.application.redaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import jp.naoj.pfs.redaction.application.port.MetricsPort;
import jp.naoj.pfs.redaction.application.port.RedactionListener;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;
import jp.naoj.pfs.redaction.domain.redaction.MaskingPolicy;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;
import jp.naoj.pfs.redaction.domain.redaction.RedactionSummary;
import jp.naoj.pfs.redaction.domain.redaction.RowMasker;
import jp.naoj.pfs.redaction.infrastructure.exec.ExecutorFactories;
import jp.naoj.pfs.redaction.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Produces one redacted view of a configuration per proposal.
 * <p><strong>Why:</strong> Proposals share exposures; each must only see its own science fibers plus the
 * calibration fibers that belong to nobody.</p>
 * <p><strong>Role:</strong> Application service between the loader and the writer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the source and resolve the policy's identifier strategy before touching any row.</li>
 *   <li>Enumerate proposals with {@link ProposalGrouper}.</li>
 *   <li>Per proposal: deep copy, mask with {@link RowMasker}, check with {@link InvariantChecker}.</li>
 *   <li>Release results through {@link OutputCollector} in proposal order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share; each call works on its own copies. With more than one
 * worker, proposals are processed on a private pool that is shut down before the call returns.</p>
 * <p><strong>Observability:</strong> MDC key {@value #MDC_PROPOSAL}; metrics {@code redaction.proposals},
 * {@code redaction.rows.masked}, {@code redaction.rows.unmasked}, {@code redaction.proposal.latencyNanos},
 * {@code redaction.consistency.failures}.</p>
 *
 * @since 0.1.0
 */
public final class RedactionEngine {
  private static final Logger log = LoggerFactory.getLogger(RedactionEngine.class);

  /** MDC key holding the proposal currently being redacted. */
  public static final String MDC_PROPOSAL = "redaction.proposal";

  private static final int MAX_LOGGED_PROPOSALS = 20;

  private final ProposalGrouper grouper = new ProposalGrouper();
  private final ConfigurationSetValidator validator = new ConfigurationSetValidator();
  private final InvariantChecker checker = new InvariantChecker();
  private final MetricsPort metrics;
  private final RedactionListener listener;
  private final int workers;
  private final long sequenceBase;

  /** Creates a sequential engine without metrics or listener, numbering results from 1. */
  public RedactionEngine() {
    this(MetricsPort.NO_OP, RedactionListener.NO_OP, 1, 0L);
  }

  /**
   * Creates an engine.
   *
   * @param metrics metrics sink; {@code null} disables metrics
   * @param listener per-proposal hook; {@code null} disables it
   * @param workers number of proposals processed concurrently; {@code 1} runs on the caller thread
   * @param sequenceBase results are numbered {@code sequenceBase + 1}, {@code sequenceBase + 2}, ...
   */
  public RedactionEngine(MetricsPort metrics, RedactionListener listener, int workers, long sequenceBase) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (sequenceBase < 0) {
      throw new IllegalArgumentException("sequenceBase must not be negative");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.listener = listener == null ? RedactionListener.NO_OP : listener;
    this.workers = workers;
    this.sequenceBase = sequenceBase;
  }

  /**
   * Redacts a configuration for every proposal it contains.
   *
   * @param source configuration to redact; never modified
   * @param policy masking policy
   * @return one result per proposal, sorted by proposal id; empty when no proposal is present
   * @throws jp.naoj.pfs.redaction.domain.redaction.InputValidationException when the source is malformed
   * @throws jp.naoj.pfs.redaction.domain.redaction.MaskingConfigurationException when the policy is unusable
   * @throws ConsistencyException when any view fails its check; no results are returned
   * @throws CancellationException when the calling thread is interrupted while waiting for workers
   */
  public List<RedactionResult> redact(ConfigurationSet source, MaskingPolicy policy) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(policy, "policy");
    validator.validate(source);
    RowMasker masker = new RowMasker(policy);

    SortedSet<String> proposals = grouper.proposals(source);
    if (proposals.isEmpty()) {
      log.info("No proposals found in {}; nothing to redact", source);
      return List.of();
    }
    log.info("Unique proposal ids: {}", Logs.abbreviate(proposals, MAX_LOGGED_PROPOSALS));
    if (log.isDebugEnabled()) {
      log.debug("Catalog ids per proposal: {}", grouper.catalogsByProposal(source));
    }

    List<Callable<RedactionResult>> tasks = new ArrayList<>(proposals.size());
    long sequence = sequenceBase;
    for (String proposalId : proposals) {
      long sequenceId = ++sequence;
      tasks.add(() -> redactOne(source, masker, proposalId, sequenceId));
    }

    OutputCollector collector = new OutputCollector();
    if (workers == 1 || tasks.size() == 1) {
      for (Callable<RedactionResult> task : tasks) {
        collector.add(call(task));
      }
    } else {
      runParallel(tasks, collector);
    }
    return collector.results();
  }

  /**
   * Redacts a configuration for a single proposal.
   *
   * @param source configuration to redact; never modified
   * @param policy masking policy
   * @param proposalId requesting proposal
   * @return the checked view, or empty when {@code proposalId} is {@link FiberRecord#NO_PROPOSAL}
   * @throws ConsistencyException when the view fails its check
   */
  public Optional<RedactionResult> redactProposal(ConfigurationSet source, MaskingPolicy policy, String proposalId) {
    Objects.requireNonNull(proposalId, "proposalId");
    if (FiberRecord.NO_PROPOSAL.equals(proposalId)) {
      log.debug("Skipping redaction for sentinel proposal {}", proposalId);
      return Optional.empty();
    }
    validator.validate(source);
    RowMasker masker = new RowMasker(policy);
    return Optional.of(redactOne(source, masker, proposalId, sequenceBase + 1));
  }

  public int workers() {
    return workers;
  }

  private RedactionResult redactOne(ConfigurationSet source, RowMasker masker, String proposalId, long sequenceId) {
    long started = System.nanoTime();
    String previous = MDC.get(MDC_PROPOSAL);
    MDC.put(MDC_PROPOSAL, proposalId);
    try {
      List<FiberRecord> rows = source.copyRows();
      int masked = 0;
      for (int i = 0; i < rows.size(); i++) {
        FiberRecord row = rows.get(i);
        if (RowMasker.shouldMask(row, proposalId)) {
          rows.set(i, masker.mask(row));
          masked++;
        }
      }
      ConfigurationSet redacted = new ConfigurationSet(source.header(), rows);

      int ownScience;
      try {
        ownScience = checker.check(source, redacted, proposalId);
      } catch (ConsistencyException ex) {
        metrics.increment("redaction.consistency.failures");
        listener.onConsistencyFailure(ex);
        throw ex;
      }

      long elapsed = System.nanoTime() - started;
      int unmasked = rows.size() - masked;
      metrics.increment("redaction.proposals");
      metrics.observe("redaction.rows.masked", masked);
      metrics.observe("redaction.rows.unmasked", unmasked);
      metrics.observe("redaction.proposal.latencyNanos", elapsed);
      listener.onProposalRedacted(
          new RedactionSummary(proposalId, rows.size(), masked, unmasked, ownScience, elapsed));
      return new RedactionResult(proposalId, redacted, sequenceId);
    } finally {
      if (previous == null) {
        MDC.remove(MDC_PROPOSAL);
      } else {
        MDC.put(MDC_PROPOSAL, previous);
      }
    }
  }

  private void runParallel(List<Callable<RedactionResult>> tasks, OutputCollector collector) {
    int poolSize = Math.min(workers, tasks.size());
    ExecutorService pool = ExecutorFactories.newRedactionPool(poolSize, tasks.size(), "pfs-redact", null);
    log.debug("Redacting {} proposals on {} workers", tasks.size(), poolSize);
    try {
      List<Future<RedactionResult>> futures = pool.invokeAll(tasks);
      for (Future<RedactionResult> future : futures) {
        collector.add(await(future));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException("redaction interrupted");
      cancelled.initCause(ex);
      throw cancelled;
    } finally {
      pool.shutdownNow();
    }
  }

  private static RedactionResult await(Future<RedactionResult> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      throw rethrow(ex.getCause());
    }
  }

  private static RedactionResult call(Callable<RedactionResult> task) {
    try {
      return task.call();
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw rethrow(ex);
    }
  }

  private static RuntimeException rethrow(Throwable cause) {
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new IllegalStateException("redaction worker failed", cause);
  }
}
