package com.climapipeline.service.store;

import com.climapipeline.core.bus.EventBus;
import com.climapipeline.core.error.ErrorKind;
import com.climapipeline.core.events.AlertRaised;
import com.climapipeline.core.events.DatasetSaved;
import com.climapipeline.core.events.Event;
import com.climapipeline.core.events.PipelineRunCompleted;
import com.climapipeline.core.events.PipelineRunStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void encodesTypeAndTimestampAroundTheEvent() {
        Event event = new PipelineRunStarted(NOW, "Medellín", LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2),
                List.of("temperature", "wind_speed"), 1);

        String line = EventCodec.toJsonLine(event);

        assertTrue(line.contains("\"type\":\"PipelineRunStarted\""));
        assertTrue(line.contains("\"timestamp\":\"2024-05-01T12:00:00Z\""));
        assertEquals(event, EventCodec.fromJsonLine(line));
    }

    @Test
    void nullErrorKindIsOmittedAndRestored() {
        Event event = new PipelineRunCompleted(NOW, "Cali", true, 24, null, 350L);

        String line = EventCodec.toJsonLine(event);

        assertFalse(line.contains("errorKind"));
        assertEquals(event, EventCodec.fromJsonLine(line));
    }

    @Test
    void alertCarriesItsErrorKindByName() {
        Event event = new AlertRaised(NOW, ErrorKind.HTTP_STATUS, "Pasto", 2, "HTTP 503 from provider");

        String line = EventCodec.toJsonLine(event);

        assertTrue(line.contains("\"kind\":\"HTTP_STATUS\""));
        assertTrue(line.contains("\"attempts\":2"));
        assertEquals(event, EventCodec.fromJsonLine(line));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EventCodec.fromJsonLine("{\"type\":\"Mystery\",\"timestamp\":\"2024-05-01T12:00:00Z\",\"event\":{}}"));
        assertThrows(IllegalStateException.class, () -> EventCodec.fromJsonLine("{broken"));
    }

    @Test
    void subscribeAllForwardsEveryPipelineEvent() {
        EventBus bus = new EventBus();
        List<Event> seen = new ArrayList<>();
        EventCodec.subscribeAll(bus, seen::add);

        bus.publish(new DatasetSaved(NOW, "data/weather_data.csv", "append", 24, 48));
        bus.publish(new PipelineRunCompleted(NOW, "Cali", false, 0, "NETWORK", 10L));
        bus.publish(new Heartbeat(NOW));

        assertEquals(2, seen.size());
        assertEquals(5, EventCodec.allEventTypes().size());
    }

    private record Heartbeat(Instant timestamp) implements Event {
        @Override
        public String type() {
            return "Heartbeat";
        }
    }
}
