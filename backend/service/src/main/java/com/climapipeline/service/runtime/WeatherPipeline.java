package com.climapipeline.service.runtime;

import com.climapipeline.collectors.api.WeatherClient;
import com.climapipeline.collectors.transform.WeatherTransformer;
import com.climapipeline.core.bus.EventBus;
import com.climapipeline.core.error.PipelineException;
import com.climapipeline.core.events.AlertRaised;
import com.climapipeline.core.events.DatasetSaved;
import com.climapipeline.core.events.PipelineRunCompleted;
import com.climapipeline.core.events.PipelineRunStarted;
import com.climapipeline.core.events.WeatherFetched;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WeatherDataset;
import com.climapipeline.service.store.WeatherStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.logging.Logger;

public class WeatherPipeline {
    private static final Logger LOGGER = Logger.getLogger(WeatherPipeline.class.getName());

    private final WeatherClient client;
    private final WeatherTransformer transformer;
    private final WeatherStore store;
    private final EventBus eventBus;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    public WeatherPipeline(
            WeatherClient client,
            WeatherTransformer transformer,
            WeatherStore store,
            EventBus eventBus,
            Clock clock,
            RetryPolicy retryPolicy
    ) {
        this.client = client;
        this.transformer = transformer;
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
    }

    public PipelineResult runPipeline(PipelineRequest request) {
        Instant startedAt = clock.instant();
        String location = request.location().name();
        DateRange range = request.dateRange() == null
                ? DateRange.today(request.location().zoneId(), clock)
                : request.dateRange();
        int attempt = 0;
        while (true) {
            attempt++;
            eventBus.publish(new PipelineRunStarted(
                    clock.instant(),
                    location,
                    range.startDate(),
                    range.endDate(),
                    request.variables().stream().sorted().map(VariableKind::shortName).toList(),
                    attempt
            ));
            try {
                PipelineResult result = runOnce(request, range, attempt);
                eventBus.publish(new PipelineRunCompleted(clock.instant(), location, true,
                        result.recordCount(), null, elapsedMillis(startedAt)));
                return result;
            } catch (PipelineException failure) {
                if (retryPolicy.shouldRetry(failure, attempt)) {
                    LOGGER.warning("Attempt " + attempt + " for " + location + " failed (" + failure.kind()
                            + "): " + failure.getMessage() + "; retrying");
                    if (!pause()) {
                        return fail(failure, location, attempt, startedAt);
                    }
                    continue;
                }
                return fail(failure, location, attempt, startedAt);
            }
        }
    }

    private PipelineResult runOnce(PipelineRequest request, DateRange range, int attempt) {
        RawWeatherResponse raw = client.fetch(request.location(), range, request.variables());
        eventBus.publish(new WeatherFetched(clock.instant(), request.location().name(), raw.hours()));

        WeatherDataset dataset = transformer.normalize(raw);
        int total = store.save(dataset, request.outputPath(), request.mode());
        eventBus.publish(new DatasetSaved(
                clock.instant(),
                request.outputPath().toString(),
                request.mode().name().toLowerCase(Locale.ROOT),
                dataset.size(),
                total
        ));
        return PipelineResult.success(total, dataset.summarize(), attempt);
    }

    private PipelineResult fail(PipelineException failure, String location, int attempt, Instant startedAt) {
        LOGGER.warning("Pipeline run for " + location + " failed (" + failure.kind() + "): " + failure.getMessage());
        eventBus.publish(new AlertRaised(clock.instant(), failure.kind(), location, attempt, failure.getMessage()));
        eventBus.publish(new PipelineRunCompleted(clock.instant(), location, false, 0,
                failure.kind().name(), elapsedMillis(startedAt)));
        return PipelineResult.failure(failure.kind(), failure.getMessage(), attempt);
    }

    private boolean pause() {
        Duration backoff = retryPolicy.backoff();
        if (backoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while waiting to retry");
            return false;
        }
    }

    private long elapsedMillis(Instant startedAt) {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }

}
