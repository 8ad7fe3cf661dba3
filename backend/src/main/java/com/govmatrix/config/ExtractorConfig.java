package com.govmatrix.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.govmatrix.extract.util.Ticker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExtractorConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ExtractorProperties properties) {
        int size = Math.max(2, properties.getAliasLookup().getConcurrency() + 1);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "aliasLookupExecutor", destroyMethod = "shutdown")
    public ExecutorService aliasLookupExecutor(ExtractorProperties properties) {
        return Executors.newFixedThreadPool(properties.getAliasLookup().getConcurrency());
    }

    @Bean(name = "extractionRunExecutor", destroyMethod = "shutdown")
    public ExecutorService extractionRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(name = "graphQlHttpClient")
    public HttpClient graphQlHttpClient(
        ExtractorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getApi().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Bean
    public Ticker ticker() {
        return Ticker.system();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
