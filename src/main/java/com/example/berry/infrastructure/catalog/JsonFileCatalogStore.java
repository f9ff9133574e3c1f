package com.example.berry.infrastructure.catalog;

import com.example.berry.common.config.AppCatalogProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JsonFileCatalogStore implements CatalogStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCatalogStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileCatalogStore(AppCatalogProperties properties, ObjectMapper objectMapper) {
        this.file = Paths.get(properties.getFile());
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized List<CatalogEntry> load() {
        if (!Files.isRegularFile(file)) {
            log.info("No saved catalog at {}, using configured items", file);
            return null;
        }
        try {
            CatalogFile catalog = objectMapper.readValue(file.toFile(), CatalogFile.class);
            if (catalog == null || catalog.getItems() == null) {
                return new ArrayList<>();
            }
            log.info("Loaded catalog from {}, itemCount={}", file, catalog.getItems().size());
            return catalog.getItems();
        } catch (IOException e) {
            log.warn("Error reading catalog file {}, using configured items", file, e);
            return null;
        }
    }

    @Override
    public synchronized boolean store(List<CatalogEntry> entries) {
        CatalogFile catalog = new CatalogFile();
        catalog.setItems(new ArrayList<>(entries));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), catalog);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.error("Error writing catalog file {}", file, e);
            return false;
        }
    }

    @Data
    public static class CatalogFile {

        private List<CatalogEntry> items = new ArrayList<>();
    }
}
