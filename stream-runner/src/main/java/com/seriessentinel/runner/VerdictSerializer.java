package com.seriessentinel.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seriessentinel.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link Verdict} → JSON bytes, one object per verdict.
 */
public class VerdictSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(VerdictSerializer.class);

    private final ObjectMapper mapper;

    public VerdictSerializer() {
        this(new ObjectMapper());
    }

    public VerdictSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param verdict verdict to serialize
     * @return UTF-8 JSON, or an empty array if serialization fails
     */
    public byte[] serialize(Verdict verdict) {
        try {
            return mapper.writeValueAsBytes(verdict);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize verdict {}: {}", verdict.getIndex(), e.getMessage(), e);
            return new byte[0];
        }
    }
}
