package com.simrelay.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.error.BadRequestException;
import com.simrelay.core.error.ForbiddenException;
import com.simrelay.core.error.UnauthorizedException;
import com.simrelay.core.metrics.RelayMetrics;
import com.simrelay.core.security.SignatureVerifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates and applies signed snapshot uploads of the form
 * {@code {"timestamp": "...", "data": {...}}}.
 */
@Service
public class StateIngestionService {

    private final SignatureVerifier signatureVerifier;
    private final StateStore stateStore;
    private final ObjectMapper objectMapper;
    private final RelayMetrics metrics;

    public StateIngestionService(SignatureVerifier signatureVerifier, StateStore stateStore,
                                 ObjectMapper objectMapper, RelayMetrics metrics) {
        this.signatureVerifier = signatureVerifier;
        this.stateStore = stateStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Verifies {@code signature} over the exact {@code body} bytes, then replaces the snapshot.
     *
     * @return top-level keys of the new snapshot, in document order
     */
    public List<String> ingest(byte[] body, String signature) {
        try {
            signatureVerifier.verify(body, signature);
        } catch (UnauthorizedException e) {
            metrics.recordIngest("unauthorized");
            throw e;
        } catch (ForbiddenException e) {
            metrics.recordIngest("forbidden");
            throw e;
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            metrics.recordIngest("bad_request");
            throw new BadRequestException("Body is not valid JSON");
        } catch (IOException e) {
            metrics.recordIngest("bad_request");
            throw new BadRequestException("Body could not be read");
        }

        JsonNode data = payload == null ? null : payload.get("data");
        if (data == null || !data.isObject()) {
            metrics.recordIngest("bad_request");
            throw new BadRequestException("'data' must be a JSON object");
        }
        JsonNode timestamp = payload.get("timestamp");
        String lastUpdated = timestamp == null || timestamp.isNull() ? null : timestamp.asText();

        stateStore.replace((ObjectNode) data, lastUpdated);
        metrics.recordIngest("accepted");

        var keys = new ArrayList<String>(data.size());
        data.fieldNames().forEachRemaining(keys::add);
        return keys;
    }
}
