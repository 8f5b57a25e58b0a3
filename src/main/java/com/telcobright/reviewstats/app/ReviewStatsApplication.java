package com.telcobright.reviewstats.app;

import com.telcobright.reviewstats.core.config.JobConfig;
import com.telcobright.reviewstats.core.job.AggregationJob;
import com.telcobright.reviewstats.core.job.JobResult;
import com.telcobright.reviewstats.core.logging.Logger;
import com.telcobright.reviewstats.core.logging.Slf4jLogger;
import com.telcobright.reviewstats.core.query.ReviewQueries;
import com.telcobright.reviewstats.core.query.ReviewQuery;
import com.telcobright.reviewstats.core.source.csv.CsvRowSource;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

/**
 * Command-line entry point: runs one review query over the CSV dataset named
 * by the environment and prints the result as JSON.
 *
 * <pre>
 * ReviewStatsApplication &lt;query&gt; [--env-file PATH]
 * </pre>
 */
public class ReviewStatsApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_JOB_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> processEnv, PrintStream out, PrintStream err) {
        if (args.length != 1 && !(args.length == 3 && "--env-file".equals(args[1]))) {
            printUsage(err);
            return EXIT_USAGE;
        }

        ReviewQuery<?> query;
        try {
            query = ReviewQueries.byName(args[0]);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        Map<String, String> fileValues = Collections.emptyMap();
        if (args.length == 3) {
            try {
                fileValues = DotEnvFile.load(Paths.get(args[2]));
            } catch (IOException e) {
                err.println("Cannot read env file " + args[2] + ": " + e.getMessage());
                return EXIT_USAGE;
            }
        }
        JobConfig config = EnvironmentConfig.fromEnvironment(EnvironmentConfig.overlay(fileValues, processEnv));

        Logger logger = new Slf4jLogger(ReviewStatsApplication.class);
        JobResult<?> result = AggregationJob.builder(query)
            .config(config)
            .rowSourceFactory(location -> new CsvRowSource(Paths.get(location)))
            .logger(logger)
            .build()
            .run();

        try {
            out.println(new JobResultWriter().toJson(result));
        } catch (IOException e) {
            logger.error("Failed to render job result", e);
            return EXIT_JOB_FAILED;
        }
        return result.isSuccess() ? EXIT_OK : EXIT_JOB_FAILED;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: ReviewStatsApplication <query> [--env-file PATH]");
        err.println("Queries: " + String.join(", ", ReviewQueries.names()));
        err.println("Environment: " + EnvironmentConfig.PATH_DATASET + ", " + EnvironmentConfig.DATASET_SIZE
            + ", " + EnvironmentConfig.WORKER_COUNT);
    }
}
