package org.docmigrations;

import java.nio.file.Path;
import java.time.Duration;

import org.docmigrations.couchdb.CouchDbConnection;
import org.docmigrations.couchdb.CouchDbDocumentStore;
import org.docmigrations.pipeline.MigrationOrchestrator;
import org.docmigrations.pipeline.MigrationSettings;
import org.docmigrations.pipeline.errors.NoStepsFoundException;
import org.docmigrations.pipeline.ir.MigrationSummary;
import org.docmigrations.pipeline.ir.VersionMarker;
import org.docmigrations.pipeline.source.DirectoryStepSource;
import org.docmigrations.pipeline.source.ServiceLoaderStepSource;
import org.docmigrations.pipeline.source.StepSource;
import org.docmigrations.pipeline.store.DocumentStore;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import lombok.extern.slf4j.Slf4j;

/**
 * Command-line entry point: migrates every document of a CouchDB database to the latest (or a given)
 * step version.
 */
@Slf4j
public class RunDocumentMigrations {
    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int FAILURE_EXIT_CODE = 1;
    public static final int NO_STEPS_EXIT_CODE = 2;
    public static final int ARGUMENT_ERROR_EXIT_CODE = 3;

    public static class DurationConverter implements IStringConverter<Duration> {
        @Override
        public Duration convert(String value) {
            try {
                return Duration.parse(value);
            } catch (RuntimeException e) {
                throw new ParameterException("Invalid duration: " + value + ". Use ISO-8601, e.g. PT5S");
            }
        }
    }

    public static class Args {
        @Parameter(
            names = {"--help", "-h"},
            help = true,
            description = "Displays information about how to use this tool")
        public boolean help;

        @ParametersDelegate
        public CouchDbConnection.ConnectionArgs connectionArgs = new CouchDbConnection.ConnectionArgs();

        @Parameter(
            names = {"--target-version", "--targetVersion"},
            description = "Optional. The version to migrate documents to. Default: the highest step version found")
        public Integer targetVersion = null;

        @Parameter(
            names = {"--page-size", "--pageSize"},
            description = "Optional. The number of documents fetched per page. Default: "
                + MigrationSettings.DEFAULT_PAGE_SIZE)
        public int pageSize = MigrationSettings.DEFAULT_PAGE_SIZE;

        @Parameter(
            names = {"--version-field", "--versionField"},
            description = "Optional. The document field holding the version marker. Default: "
                + VersionMarker.DEFAULT_FIELD_NAME)
        public String versionField = VersionMarker.DEFAULT_FIELD_NAME;

        @Parameter(
            names = {"--steps-dir", "--stepsDir"},
            description = "Optional. A directory of jars providing migration steps, in addition to the classpath")
        public String stepsDir = null;

        @Parameter(
            names = {"--install-view", "--installView"},
            description = "Optional. Create the version view before migrating if it does not exist. Default: false")
        public boolean installView = false;

        @Parameter(
            names = {"--progress-interval", "--progressInterval"},
            converter = DurationConverter.class,
            description = "Optional. How often progress is logged. Default: PT5S")
        public Duration progressInterval = MigrationSettings.DEFAULT_PROGRESS_INTERVAL;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] rawArgs) {
        var args = new Args();
        var jCommander = JCommander.newBuilder().addObject(args).build();
        jCommander.setProgramName(RunDocumentMigrations.class.getSimpleName());
        try {
            jCommander.parse(rawArgs);
        } catch (ParameterException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            jCommander.usage();
            return ARGUMENT_ERROR_EXIT_CODE;
        }
        if (args.help) {
            jCommander.usage();
            return SUCCESS_EXIT_CODE;
        }

        final MigrationSettings settings;
        final CouchDbDocumentStore store;
        try {
            settings = toSettings(args);
            store = new CouchDbDocumentStore(args.connectionArgs.toConnection());
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return ARGUMENT_ERROR_EXIT_CODE;
        }
        log.info("Starting document migrations with {}", settings);

        if (args.installView) {
            try {
                store.installVersionView(settings.getVersionField()).block();
            } catch (RuntimeException e) {
                log.error("Unable to install the version view", e);
                return FAILURE_EXIT_CODE;
            }
        }
        return run(args, store, stepSourceFor(args), settings);
    }

    /** Runs the migration against an already built store and step source, and closes both. */
    public static int run(Args args, DocumentStore store, StepSource steps, MigrationSettings settings) {
        var orchestrator = new MigrationOrchestrator(steps, store, settings);
        try {
            MigrationSummary summary = orchestrator.runMigrations(args.targetVersion).block();
            log.info("Migration to version {} finished in {}", summary.targetVersion(), summary.elapsed());
            return summary.failed() > 0 || summary.unresolved() > 0 ? FAILURE_EXIT_CODE : SUCCESS_EXIT_CODE;
        } catch (NoStepsFoundException e) {
            log.error(e.getMessage());
            return NO_STEPS_EXIT_CODE;
        } catch (RuntimeException e) {
            log.error("Migration failed", e);
            return FAILURE_EXIT_CODE;
        } finally {
            closeQuietly(steps, "migration step source");
            closeQuietly(store, "document store");
        }
    }

    static MigrationSettings toSettings(Args args) {
        return MigrationSettings.builder()
            .versionField(args.versionField)
            .pageSize(args.pageSize)
            .progressInterval(args.progressInterval)
            .build();
    }

    static StepSource stepSourceFor(Args args) {
        if (args.stepsDir != null) {
            return new DirectoryStepSource(Path.of(args.stepsDir));
        }
        return new ServiceLoaderStepSource();
    }

    private static void closeQuietly(AutoCloseable resource, String description) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Unable to close the {}", description, e);
        }
    }
}
