package com.facefinder.storage.config;

import com.facefinder.common.serialization.IndexSnapshotDeserializer;
import com.facefinder.common.serialization.IndexSnapshotSerializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

    @Bean
    public IndexSnapshotSerializer indexSnapshotSerializer() {
        return new IndexSnapshotSerializer();
    }

    @Bean
    public IndexSnapshotDeserializer indexSnapshotDeserializer() {
        return new IndexSnapshotDeserializer();
    }
}
