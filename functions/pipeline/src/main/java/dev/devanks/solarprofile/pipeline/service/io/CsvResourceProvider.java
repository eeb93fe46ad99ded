package dev.devanks.solarprofile.pipeline.service.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Resolves CSV locations ({@code file:} or {@code gs://}) through the application's resource
 * loader; the GCS protocol resolver is registered by the storage starter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvResourceProvider {

    private final ResourceLoader resourceLoader;

    public Resource readableResource(String location) {
        return resourceLoader.getResource(location);
    }

    /**
     * Local parent directories are created on the way.
     */
    public WritableResource writableResource(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!(resource instanceof WritableResource)) {
            throw new IOException("Location is not writable: " + location);
        }
        if (resource.isFile()) {
            File parent = resource.getFile().getParentFile();
            if (parent != null) {
                Files.createDirectories(parent.toPath());
                log.debug("Ensured directory {} exists.", parent);
            }
        }
        return (WritableResource) resource;
    }
}
