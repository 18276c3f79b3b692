package com.climapipeline.service;

import com.climapipeline.collectors.api.WeatherClient;
import com.climapipeline.collectors.fixture.FixtureWeatherClient;
import com.climapipeline.collectors.openmeteo.OpenMeteoClient;
import com.climapipeline.collectors.transform.WeatherTransformer;
import com.climapipeline.core.bus.EventBus;
import com.climapipeline.core.error.PipelineException;
import com.climapipeline.core.model.DatasetSummary;
import com.climapipeline.core.model.WriteMode;
import com.climapipeline.service.cache.CachingWeatherClient;
import com.climapipeline.service.cache.ResponseCache;
import com.climapipeline.service.config.ConfigLoader;
import com.climapipeline.service.config.LocationCatalog;
import com.climapipeline.service.config.OutputPaths;
import com.climapipeline.service.config.PipelineConfig;
import com.climapipeline.service.http.HttpClientFactory;
import com.climapipeline.service.runtime.PipelineRequest;
import com.climapipeline.service.runtime.PipelineResult;
import com.climapipeline.service.runtime.RetryPolicy;
import com.climapipeline.service.runtime.WeatherPipeline;
import com.climapipeline.service.store.CsvWeatherStore;
import com.climapipeline.service.store.EventCodec;
import com.climapipeline.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private Main() {
    }

    public static void main(String[] args) {
        installLogging();
        System.exit(run(args, Clock.systemUTC()));
    }

    static int run(String[] args, Clock clock) {
        CliArgs cli;
        PipelineConfig config;
        try {
            cli = CliArgs.parse(args);
            config = resolveConfig(cli);
        } catch (IllegalArgumentException | PipelineException e) {
            LOGGER.severe(e.getMessage());
            LOGGER.severe("Usage: Main [configDir] [--location NAME] [--mode overwrite|append]");
            return EXIT_USAGE;
        }

        PipelineRequest request;
        WeatherPipeline pipeline;
        try {
            request = new PipelineRequest(
                    config.location(),
                    config.dates().resolve(config.location().zoneId(), clock),
                    config.variableKinds(),
                    OutputPaths.resolve(config.output(), clock),
                    config.output().mode()
            );
            EventBus eventBus = new EventBus();
            JsonlEventStore eventStore = new JsonlEventStore(Path.of(config.eventLog()));
            EventCodec.subscribeAll(eventBus, eventStore::append);
            pipeline = new WeatherPipeline(
                    buildClient(config, clock),
                    new WeatherTransformer(),
                    new CsvWeatherStore(),
                    eventBus,
                    clock,
                    new RetryPolicy(config.retry().maxAttempts(), config.retry().backoff())
            );
        } catch (IllegalArgumentException | PipelineException e) {
            LOGGER.severe("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        LOGGER.info("Running pipeline for " + request.location().name() + " " + request.dateRange().startDate()
                + ".." + request.dateRange().endDate() + " -> " + request.outputPath() + " (" + request.mode() + ")");
        PipelineResult result = pipeline.runPipeline(request);
        if (!result.success()) {
            LOGGER.severe("Pipeline failed [" + result.errorKind() + "] after " + result.attempts()
                    + " attempt(s): " + result.message());
            return EXIT_RUN_FAILED;
        }
        LOGGER.info("Saved " + result.recordCount() + " rows to " + request.outputPath());
        logSummary(result.summary());
        return EXIT_OK;
    }

    static PipelineConfig resolveConfig(CliArgs cli) {
        PipelineConfig config = ConfigLoader.loadPipeline(cli.configDir());
        if (cli.location() != null) {
            LocationCatalog catalog = ConfigLoader.loadLocations(cli.configDir());
            config = config.withLocation(catalog.find(cli.location())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown location: " + cli.location())));
        }
        if (cli.mode() != null) {
            config = config.withMode(cli.mode());
        }
        return config;
    }

    static WeatherClient buildClient(PipelineConfig config, Clock clock) {
        PipelineConfig.Http http = config.http();
        WeatherClient client;
        if (http.fixtureFile() != null && !http.fixtureFile().isBlank()) {
            LOGGER.info("Using fixture responses from " + http.fixtureFile());
            client = new FixtureWeatherClient(Path.of(http.fixtureFile()));
        } else {
            HttpClient httpClient = HttpClientFactory.create(http.connectTimeout());
            client = new OpenMeteoClient(httpClient, URI.create(http.baseUrl()), http.requestTimeout(), clock,
                    http.userAgent());
        }
        PipelineConfig.Cache cache = config.cache();
        if (Boolean.TRUE.equals(cache.enabled())) {
            Path cacheFile = Path.of(cache.directory()).resolve("responses.json");
            client = new CachingWeatherClient(client, new ResponseCache(cacheFile, cache.ttl(), clock), clock);
        }
        return client;
    }

    private static void logSummary(DatasetSummary summary) {
        if (summary == null || summary.rows() == 0) {
            LOGGER.info("No hourly rows fetched");
            return;
        }
        LOGGER.info("Fetched " + summary.rows() + " rows " + summary.first() + " .. " + summary.last()
                + "; mean temperature " + summary.meanTemperatureC() + " °C"
                + ", mean humidity " + summary.meanHumidityPct() + " %"
                + ", total precipitation " + summary.totalPrecipitationMm() + " mm"
                + ", mean wind speed " + summary.meanWindSpeedKmh() + " km/h");
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Failed to load logging.properties: " + e.getMessage());
        }
    }

    record CliArgs(Path configDir, String location, WriteMode mode) {
        static CliArgs parse(String[] args) {
            Path configDir = Path.of("config");
            String location = null;
            WriteMode mode = null;
            boolean sawConfigDir = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--location":
                        location = valueAfter(args, ++i, arg);
                        break;
                    case "--mode":
                        mode = WriteMode.parse(valueAfter(args, ++i, arg));
                        break;
                    default:
                        if (arg.startsWith("--") || sawConfigDir) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        configDir = Path.of(arg);
                        sawConfigDir = true;
                }
            }
            return new CliArgs(configDir, location, mode);
        }

        private static String valueAfter(String[] args, int index, String flag) {
            if (index >= args.length || args[index].isBlank()) {
                throw new IllegalArgumentException(flag + " needs a value");
            }
            return args[index];
        }
    }
}
