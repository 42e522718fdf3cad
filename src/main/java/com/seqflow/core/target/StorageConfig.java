package com.seqflow.core.target;

import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public ObjectStoreRegistry objectStoreRegistry(StorageProperties properties) {
        var registry = new ObjectStoreRegistry();
        if (properties.isMirrorConfigured()) {
            var mirror = new FileSystemObjectStore(Path.of(properties.getMirrorRoot()));
            for (String scheme : properties.getMirrorSchemes()) {
                registry.register(scheme, mirror);
                log.info("Serving {}:// from mirror root {}", scheme, mirror.root());
            }
        }
        if (properties.getGcs().isEnabled() && registry.lookup("gs").isEmpty()) {
            var options = StorageOptions.newBuilder();
            String projectId = properties.getGcs().getProjectId();
            if (projectId != null && !projectId.isBlank()) {
                options.setProjectId(projectId);
            }
            registry.register("gs", new GcsObjectStore(options.build().getService()));
            log.info("Serving gs:// from Google Cloud Storage");
        }
        return registry;
    }

    @Bean
    public TargetFactory targetFactory(ObjectStoreRegistry registry) {
        return new TargetFactory(registry);
    }
}
