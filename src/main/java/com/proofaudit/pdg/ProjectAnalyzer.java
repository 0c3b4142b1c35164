package com.proofaudit.pdg;

import com.proofaudit.pdg.api.FrontEndScanner;
import com.proofaudit.pdg.api.ScanListener;
import com.proofaudit.pdg.engine.GraphAssembler;
import com.proofaudit.pdg.glob.MetadataScanner;
import com.proofaudit.pdg.glob.ProofStatusProbe;
import com.proofaudit.pdg.glob.StatementExtractor;
import com.proofaudit.pdg.model.FileScan;
import com.proofaudit.pdg.model.SourceUnit;
import com.proofaudit.pdg.scan.HeuristicScanner;
import com.proofaudit.pdg.util.CompositeScanListener;
import com.proofaudit.pdg.util.ScanTimingListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point: turns a set of source files into a frozen {@link ProjectGraph}.
 * <p>
 * A run has two phases:
 * <ul>
 * <li><b>Scan</b>: every file is read and scanned independently, on a fixed
 * pool of {@link AnalysisOptions#getParallelism()} threads. A file that fails
 * is logged, reported to the listeners and skipped.</li>
 * <li><b>Assemble</b>: after all scans have joined, names are resolved, the
 * graph is built and taint is propagated, once, on the calling thread.</li>
 * </ul>
 * Results are joined in input order, so output does not depend on thread
 * scheduling.
 * <p>
 * A run aborts with {@link IllegalStateException} before any graph is built
 * when there is nothing to analyze: no input files, no file with compiler
 * metadata under {@link FrontEnd#METADATA}, or no file that scanned
 * successfully.
 */
public class ProjectAnalyzer {
    private static final Logger log = LogManager.getLogger(ProjectAnalyzer.class);

    private final AnalysisOptions options;
    private final FrontEndScanner scanner;
    private final CompositeScanListener compositeListener = new CompositeScanListener();

    public ProjectAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public ProjectAnalyzer(AnalysisOptions options) {
        this(options, scannerFor(options.validate()));
    }

    /**
     * Uses a custom scanner. {@link AnalysisOptions#getFrontEnd()} still picks
     * the resolver, so it must match the kind of output the scanner produces.
     */
    public ProjectAnalyzer(AnalysisOptions options, FrontEndScanner scanner) {
        this.options = options.validate();
        this.scanner = scanner;
    }

    public static FrontEndScanner scannerFor(AnalysisOptions options) {
        return switch (options.getFrontEnd()) {
            case HEURISTIC -> new HeuristicScanner(options.getUnterminatedProofPolicy());
            case METADATA -> new MetadataScanner(
                    new StatementExtractor(options.getStatementWindowBytes(), options.getMaxStatementLength()),
                    new ProofStatusProbe(options.getProofScanLimitBytes()));
        };
    }

    /**
     * Registers a listener for the scan phase. Adds to, rather than replaces,
     * the listeners already registered.
     */
    public void addListener(ScanListener listener) {
        compositeListener.addForComposite(listener);
    }

    /** Registers and returns a timing listener. */
    public ScanTimingListener enableScanTiming() {
        ScanTimingListener timing = new ScanTimingListener();
        compositeListener.addForComposite(timing);
        return timing;
    }

    public AnalysisOptions options() {
        return options;
    }

    /** Analyzes units already in memory. */
    public ProjectGraph analyze(List<SourceUnit> units) {
        List<Job> jobs = new ArrayList<>(units.size());
        for (SourceUnit u : units)
            jobs.add(new Job(u.path(), () -> u));
        return run(jobs);
    }

    /**
     * Reads and analyzes source files. Each file's {@code .glob} companion is
     * picked up when it sits next to it. A file that cannot be read is
     * skipped like one that fails to scan.
     *
     * @param root  project root; paths in the graph are relative to it
     * @param files {@code .v} files, already enumerated by the caller
     */
    public ProjectGraph analyzeFiles(Path root, List<Path> files) {
        List<Job> jobs = new ArrayList<>(files.size());
        for (Path f : files)
            jobs.add(new Job(root.relativize(f).toString().replace('\\', '/'), () -> SourceUnit.load(root, f)));
        return run(jobs);
    }

    private ProjectGraph run(List<Job> jobs) {
        if (jobs.isEmpty())
            throw new IllegalStateException("No source files to analyze");

        log.info("Scanning {} files with the {} front-end on {} thread(s)", jobs.size(), options.getFrontEnd(),
                options.getParallelism());
        compositeListener.onScanStart(jobs.size());

        List<Outcome> outcomes = execute(jobs);

        List<FileScan> scans = new ArrayList<>(jobs.size());
        int failed = 0, skipped = 0;
        for (int i = 0; i < outcomes.size(); i++) {
            Outcome o = outcomes.get(i);
            if (o.error() != null) {
                failed++;
                log.warn("Skipping {}: {}", jobs.get(i).path(), o.error().toString());
                compositeListener.onFileError(i, jobs.get(i).path(), o.error());
            } else if (o.scan() == null) {
                skipped++;
                log.debug("Skipping {}: not accepted by the {} front-end", jobs.get(i).path(),
                        options.getFrontEnd());
            } else {
                scans.add(o.scan());
                compositeListener.onFileScanned(i, o.scan(), o.durationNanos());
            }
        }
        compositeListener.onScanEnd(scans.size(), failed);

        if (skipped == jobs.size() && options.getFrontEnd() == FrontEnd.METADATA)
            throw new IllegalStateException("None of the " + jobs.size()
                    + " source files has compiler metadata (.glob); compile the project first");
        if (scans.isEmpty())
            throw new IllegalStateException("None of the " + jobs.size() + " source files could be scanned");

        log.info("Scanned {} files ({} failed, {} without metadata)", scans.size(), failed, skipped);
        return new GraphAssembler(options.getFrontEnd(), options.isProofBodyReferences()).assemble(scans);
    }

    private List<Outcome> execute(List<Job> jobs) {
        List<Outcome> outcomes = new ArrayList<>(jobs.size());
        int threads = Math.min(options.getParallelism(), jobs.size());
        if (threads <= 1) {
            for (Job job : jobs)
                outcomes.add(scanOne(job));
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        try {
            List<Future<Outcome>> futures = new ArrayList<>(jobs.size());
            for (Job job : jobs)
                futures.add(pool.submit(() -> scanOne(job)));
            for (Future<Outcome> f : futures)
                outcomes.add(f.get());
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning", e);
        } catch (ExecutionException e) {
            // scanOne captures exceptions, so only an Error can get here
            throw new IllegalStateException("Scan worker died", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private Outcome scanOne(Job job) {
        try {
            SourceUnit unit = job.loader().call();
            if (!scanner.accepts(unit))
                return new Outcome(null, 0, null);
            long start = System.nanoTime();
            FileScan scan = scanner.scan(unit);
            return new Outcome(scan, System.nanoTime() - start, null);
        } catch (Exception e) {
            return new Outcome(null, 0, e);
        }
    }

    private record Job(String path, Callable<SourceUnit> loader) {
    }

    private record Outcome(FileScan scan, long durationNanos, Exception error) {
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pdg-scan-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
