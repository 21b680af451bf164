package com.dps.scheduler.booking.location;

import com.dps.scheduler.booking.model.SiteLocation;
import com.dps.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
public class FileLocationSelectionCache implements LocationSelectionCache {
    private static final Logger log = LoggerFactory.getLogger(FileLocationSelectionCache.class);
    private static final String FILE_NAME = "location.json";

    private final Path cacheFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileLocationSelectionCache(SchedulerProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getApp().getCacheDir()).resolve(FILE_NAME), objectMapper);
    }

    FileLocationSelectionCache(Path cacheFile, ObjectMapper objectMapper) {
        this.cacheFile = cacheFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<List<SiteLocation>> load() {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        try {
            List<SiteLocation> locations = objectMapper.readValue(cacheFile.toFile(), new TypeReference<List<SiteLocation>>() {
            });
            if (locations == null || locations.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(List.copyOf(locations));
        } catch (IOException e) {
            log.warn("Ignoring unreadable location cache {}", cacheFile, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(List<SiteLocation> locations) {
        try {
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(cacheFile.toFile(), locations);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write location cache " + cacheFile, e);
        }
    }

    Path cacheFile() {
        return cacheFile;
    }
}
