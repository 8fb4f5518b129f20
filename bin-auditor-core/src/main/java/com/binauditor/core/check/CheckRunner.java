package com.binauditor.core.check;

import com.binauditor.core.config.AuditConfig;
import com.binauditor.core.crypto.TrustMaterial;
import com.binauditor.core.inspect.BinaryInputException;
import com.binauditor.core.inspect.BinaryInspector;
import com.binauditor.core.inspect.InspectedBinary;
import com.binauditor.core.model.CheckResult;
import com.binauditor.core.model.ComplianceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs every registered check against one inspected binary on a bounded worker pool.
 *
 * <p>Each check writes its result into the slot matching its registration index, so the
 * report lists results in registration order no matter which worker finishes first. A
 * check that throws yields a failing result; it never aborts the run. When the format
 * could not be parsed, checks that need a descriptor are not called and fail with
 * {@link InspectedBinary#UNSUPPORTED_FORMAT}.
 *
 * <p>After cancellation or the deadline no further check starts. Running checks finish,
 * slots that were never filled are left out and the report is marked partial.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CheckRunner runner = new CheckRunner(CheckRegistry.withDefaultChecks(), config, trust, Clock.systemUTC());
 * ComplianceReport report = runner.runAll(Path.of("app.exe"));
 * }</pre>
 */
public class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    private final CheckRegistry registry;
    private final AuditConfig config;
    private final TrustMaterial trust;
    private final Clock clock;
    private final RunOptions options;
    private final BinaryInspector inspector;

    public CheckRunner(CheckRegistry registry, AuditConfig config, TrustMaterial trust, Clock clock) {
        this(registry, config, trust, clock, RunOptions.from(config), new BinaryInspector());
    }

    public CheckRunner(CheckRegistry registry, AuditConfig config, TrustMaterial trust, Clock clock,
                       RunOptions options, BinaryInspector inspector) {
        this.registry = registry;
        this.config = config == null ? AuditConfig.defaults() : config;
        this.trust = trust == null ? TrustMaterial.empty() : trust;
        this.clock = clock;
        this.options = options;
        this.inspector = inspector;
    }

    /**
     * Inspects the file and runs all checks.
     *
     * @param binary path to the binary
     * @return report; never null
     * @throws BinaryInputException if the file cannot be opened
     */
    public ComplianceReport runAll(Path binary) throws BinaryInputException {
        return runAll(inspector.inspect(binary));
    }

    public ComplianceReport runAll(InspectedBinary binary) {
        return runAll(binary, new CancellationSignal());
    }

    /**
     * Runs all checks against an already inspected binary.
     *
     * @param binary inspected binary, shared read-only by all workers
     * @param cancellation signal that stops scheduling further checks
     * @return report, partial if some checks never started
     */
    public ComplianceReport runAll(InspectedBinary binary, CancellationSignal cancellation) {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadlineNanos = options.hasDeadline() ? startNanos + options.timeout().toNanos() : Long.MAX_VALUE;

        List<ComplianceCheck> checks = registry.checks();
        CheckContext context = new CheckContext(binary, config, trust, startedAt);
        AtomicReferenceArray<CheckResult> slots = new AtomicReferenceArray<>(checks.size());

        log.info("Running {} checks on {} ({}) with {} worker(s)", checks.size(), binary.path(),
            binary.format().displayName(), options.parallelism());

        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(options.parallelism(), Math.max(1, checks.size())), new WorkerThreadFactory());
        try {
            for (int i = 0; i < checks.size(); i++) {
                int index = i;
                ComplianceCheck check = checks.get(i);
                executor.execute(() -> {
                    if (cancellation.isCancelled() || System.nanoTime() - deadlineNanos >= 0) {
                        log.debug("Skipping {}: run cancelled or past deadline", check.getId());
                        return;
                    }
                    slots.set(index, runOne(check, context));
                });
            }
        } finally {
            executor.shutdown();
        }
        awaitCompletion(executor, cancellation, deadlineNanos);

        List<CheckResult> results = new ArrayList<>(checks.size());
        for (int i = 0; i < checks.size(); i++) {
            CheckResult result = slots.get(i);
            if (result != null) {
                results.add(result);
            }
        }
        boolean partial = results.size() < checks.size();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ComplianceReport report = ComplianceReport.of(startedAt, binary.path().toString(), binary.sha256(),
            binary.format(), results, elapsed, partial);

        if (partial) {
            log.warn("Run on {} was cut short: {} of {} checks completed", binary.path(), results.size(), checks.size());
        }
        log.info("Completed {} checks: {} passed, {} failed in {} ms", report.totalChecks(), report.passedChecks(),
            report.failedChecks(), elapsed.toMillis());
        return report;
    }

    private CheckResult runOne(ComplianceCheck check, CheckContext context) {
        long start = System.nanoTime();
        CheckResult result;
        if (check.requiresDescriptor() && !context.binary().hasDescriptor()) {
            log.debug("Check {} needs a parsed {} binary; reporting degraded result", check.getId(),
                context.binary().format().displayName());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("format", context.binary().format().displayName());
            if (context.binary().formatError() != null) {
                metadata.put("format_error", context.binary().formatError());
            }
            result = CheckResult.fail(check.getId(), check.getDescription(), InspectedBinary.UNSUPPORTED_FORMAT,
                metadata);
        } else {
            result = execute(check, context);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.debug("Check {} finished with {} in {} ms", check.getId(), result.status().label(), elapsed.toMillis());
        return result.withDuration(elapsed);
    }

    private CheckResult execute(ComplianceCheck check, CheckContext context) {
        try {
            CheckResult result = check.execute(context);
            if (result == null) {
                throw new IllegalStateException("check returned no result");
            }
            return result;
        } catch (Throwable e) {
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw (VirtualMachineError) e;
            }
            CheckExecutionException failure = new CheckExecutionException(check.getId(), e);
            log.error(failure.getMessage(), e);
            return CheckResult.fail(check.getId(), check.getDescription(), failure.getMessage(),
                Map.of("error", e.getClass().getSimpleName()));
        }
    }

    private static void awaitCompletion(ExecutorService executor, CancellationSignal cancellation, long deadlineNanos) {
        try {
            if (deadlineNanos != Long.MAX_VALUE) {
                long remaining = deadlineNanos - System.nanoTime();
                if (!executor.awaitTermination(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                    log.warn("Deadline reached; no further checks will start");
                    cancellation.cancel();
                }
            }
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.debug("Waiting for running checks to finish");
            }
        } catch (InterruptedException e) {
            cancellation.cancel();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for checks; reporting completed results only");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "binauditor-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
