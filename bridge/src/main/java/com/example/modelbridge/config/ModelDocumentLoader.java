package com.example.modelbridge.config;

import com.example.modelbridge.document.ModelDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the model document named by {@code bridge.model-file} at startup. Without a file, or when the
 * file cannot be read, the store keeps its empty model.
 * <p>
 * Locations with a prefix ({@code classpath:}, {@code file:}) go through the resource loader; plain
 * paths are read from the file system.
 * </p>
 */
@Component
@Order(1)
@Slf4j
public class ModelDocumentLoader implements ApplicationRunner {

    private final ModelDocumentStore store;
    private final JsonMapper jsonMapper;
    private final ResourceLoader resourceLoader;
    private final String modelFile;

    public ModelDocumentLoader(ModelDocumentStore store, JsonMapper jsonMapper, ResourceLoader resourceLoader,
                               @Value("${bridge.model-file:}") String modelFile) {
        this.store = store;
        this.jsonMapper = jsonMapper;
        this.resourceLoader = resourceLoader;
        this.modelFile = modelFile != null ? modelFile.trim() : "";
    }

    @Override
    public void run(ApplicationArguments args) {
        if (modelFile.isEmpty()) {
            log.info("No bridge.model-file configured; starting with an empty model");
            return;
        }
        load(modelFile);
    }

    void load(String location) {
        Resource resource = location.contains(":") && !location.matches("^[A-Za-z]:[\\\\/].*")
                ? resourceLoader.getResource(location)
                : new FileSystemResource(location);
        if (!resource.exists()) {
            log.warn("Model file not found: {}", location);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode document = jsonMapper.readTree(in);
            if (!(document instanceof ObjectNode model)) {
                log.error("Model file {} does not contain a JSON object", location);
                return;
            }
            store.open(model, resource.getFilename());
        } catch (JacksonException e) {
            log.error("Failed to parse model file {}: {}", location, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read model file {}: {}", location, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.error("Invalid model file {}: {}", location, e.getMessage());
        }
    }
}
