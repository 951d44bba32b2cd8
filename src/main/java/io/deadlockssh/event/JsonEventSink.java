package io.deadlockssh.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import static io.deadlockssh.constant.TarpitConstant.EVENT_LOGGER_NAME;

/**
 * Writes each event as one JSON line to the {@value io.deadlockssh.constant.TarpitConstant#EVENT_LOGGER_NAME}
 * logger. Persistence and rotation belong to the logging backend.
 */
@Slf4j(topic = EVENT_LOGGER_NAME)
public class JsonEventSink implements EventSink {

    private final ObjectMapper mapper;

    public JsonEventSink() {
        this(new ObjectMapper());
    }

    public JsonEventSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void emit(SessionEvent event) {
        try {
            log.info(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize session event {}", event, e);
        }
    }
}
