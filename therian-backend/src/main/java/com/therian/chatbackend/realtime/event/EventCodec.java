package com.therian.chatbackend.realtime.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON codec for socket frames, backed by the application's ObjectMapper.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventCodec {

    private final ObjectMapper objectMapper;

    /**
     * @return empty for unparseable frames and unknown event types
     */
    public Optional<InboundEvent> decode(String payload) {
        try {
            return Optional.ofNullable(objectMapper.readValue(payload, InboundEvent.class));
        } catch (JsonProcessingException e) {
            log.debug("Undecodable frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String encode(OutboundEvent event) {
        try {
            return objectMapper.writerFor(OutboundEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + event.getClass().getSimpleName(), e);
        }
    }
}
