package com.govmatrix.extract.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.util.AddressUtils;
import com.govmatrix.extract.util.Ticker;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class CheckpointStoreFactory {
    private final ExtractorProperties properties;
    private final ObjectMapper objectMapper;
    private final Ticker ticker;

    public CheckpointStoreFactory(ExtractorProperties properties, ObjectMapper objectMapper, Ticker ticker) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.ticker = ticker;
    }

    public CheckpointStore forOrganization(String slug) {
        Path directory = Path.of(properties.getCheckpoint().getDirectory());
        return new CheckpointStore(directory, AddressUtils.slugForFiles(slug), objectMapper, ticker);
    }
}
