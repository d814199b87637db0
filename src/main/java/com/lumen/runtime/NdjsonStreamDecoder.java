package com.lumen.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.model.RuntimeGenerateResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for a newline-delimited JSON generation stream.
 * <p>
 * Bytes are buffered until a newline arrives, so records and multi-byte characters
 * split across network reads decode intact. Unparsable lines are skipped with a
 * warning. Nothing is emitted after a record with {@code done=true}.
 * <p>
 * Not thread-safe; use one instance per response body.
 */
@Slf4j
public class NdjsonStreamDecoder {

    private final ObjectMapper objectMapper;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean done;

    public NdjsonStreamDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Consume one chunk of the body.
     *
     * @return records completed by this chunk, in order
     */
    public List<RuntimeGenerateResponse> feed(byte[] chunk) {
        List<RuntimeGenerateResponse> records = new ArrayList<>();
        for (byte b : chunk) {
            if (b == '\n') {
                decodeLine(records);
            } else {
                pending.write(b);
            }
        }
        return records;
    }

    /**
     * Parse whatever is buffered at end of input.
     */
    public List<RuntimeGenerateResponse> flush() {
        List<RuntimeGenerateResponse> records = new ArrayList<>();
        decodeLine(records);
        return records;
    }

    public boolean isDone() {
        return done;
    }

    private void decodeLine(List<RuntimeGenerateResponse> records) {
        String line = pending.toString(StandardCharsets.UTF_8).trim();
        pending.reset();
        if (line.isEmpty() || done) {
            return;
        }
        try {
            RuntimeGenerateResponse record = objectMapper.readValue(line, RuntimeGenerateResponse.class);
            records.add(record);
            if (record.isDone()) {
                done = true;
            }
        } catch (JsonProcessingException e) {
            log.warn("Skipping undecodable stream line: {} ({})", abbreviate(line), e.getOriginalMessage());
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
