package org.repcluster.app;

import lombok.extern.slf4j.Slf4j;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.core.ClusteringConfigurationException;
import org.repcluster.clustering.core.ClusteringDataException;
import org.repcluster.clustering.engine.ConvergenceWarning;
import org.repcluster.clustering.io.ExportCsvWriter;
import org.repcluster.clustering.io.ProfilesCsvReader;
import org.repcluster.clustering.pipeline.PipelineResult;
import org.repcluster.clustering.pipeline.PipelineRunContext;
import org.repcluster.clustering.pipeline.RepresentativePeriodPipeline;
import org.repcluster.clustering.profile.ProfileTable;
import org.repcluster.serialization.flexbuffers.RepresentativePeriodArtifact;
import org.repcluster.serialization.flexbuffers.RepresentativePeriodArtifactCodec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line entry point: reads a profiles CSV, runs the pipeline and writes the export
 * tables.
 *
 * <pre>Main &lt;profiles.csv&gt; &lt;output-dir&gt; [key=value ...]</pre>
 *
 * <p>Options override {@code repcluster.*} system properties. {@code artifact=true} also
 * writes {@value #ARTIFACT_FILE}.</p>
 */
@Slf4j
public class Main {
    public static final String ARTIFACT_FILE = "clustering.flex";
    static final String OPTION_ARTIFACT = "artifact";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Launches the CLI and exits with a nonzero status on failure.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs the CLI without exiting the JVM.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args == null || args.length < 2) {
            err.println("usage: Main <profiles.csv> <output-dir> [key=value ...]");
            return EXIT_USAGE;
        }
        Path input = Path.of(args[0]);
        Path outputDir = Path.of(args[1]);
        Map<String, String> options = new LinkedHashMap<>();
        for (int i = 2; i < args.length; i++) {
            int eq = args[i].indexOf('=');
            if (eq <= 0) {
                err.println("malformed option (expected key=value): " + args[i]);
                return EXIT_USAGE;
            }
            options.put(args[i].substring(0, eq).trim(), args[i].substring(eq + 1).trim());
        }
        boolean writeArtifact = Boolean.parseBoolean(options.remove(OPTION_ARTIFACT));

        try {
            ClusteringConfig config = ClusteringConfig.fromSystemProperties().withOverrides(options);
            PipelineRunContext context = PipelineRunContext.create(config);
            ProfileTable table = ProfilesCsvReader.read(input);
            PipelineResult result = new RepresentativePeriodPipeline().run(table, context);

            ExportCsvWriter.writeAll(result.getExportTables(), outputDir);
            if (writeArtifact) {
                writeArtifact(result, config, outputDir.resolve(ARTIFACT_FILE));
            }
            for (ConvergenceWarning warning : result.getWarnings()) {
                err.println("warning: " + warning.message());
            }
            out.println("run " + result.getRunId() + ": " + result.getClustering().numPeriods()
                    + " periods -> " + result.getClustering().numRepresentativePeriods()
                    + " representative periods, written to " + outputDir);
            return EXIT_OK;
        } catch (ClusteringConfigurationException | ClusteringDataException ex) {
            log.error("Run failed: {}", ex.getMessage());
            err.println("error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            log.error("I/O failure", ex);
            err.println("error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void writeArtifact(PipelineResult result, ClusteringConfig config, Path target) throws IOException {
        RepresentativePeriodArtifact artifact = RepresentativePeriodArtifact.builder()
                .runId(result.getRunId())
                .periodDuration(config.getPeriodDuration())
                .numRepresentativePeriods(result.getClustering().numRepresentativePeriods())
                .distanceMetric(result.getClustering().distanceMetricId())
                .converged(result.getClustering().converged())
                .tables(result.getExportTables())
                .build();
        Files.write(target, RepresentativePeriodArtifactCodec.encode(artifact));
        log.info("Wrote artifact {}", target);
    }
}
