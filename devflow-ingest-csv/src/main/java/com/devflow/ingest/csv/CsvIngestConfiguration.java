package com.devflow.ingest.csv;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CsvIngestProperties.class)
public class CsvIngestConfiguration {

    @Bean
    public CsvEventLogLoader csvEventLogLoader(CsvIngestProperties props) {
        return new CsvEventLogLoader(props);
    }
}
