package com.example.modelbridge.config;

import com.example.modelbridge.command.CommandDispatcher;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.http.ModelBridge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.DefaultResourceLoader;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "bridge.data-port=0",
        "bridge.command-port=0",
        "bridge.model-file=classpath:models/test-model.json"
})
@DisplayName("Model bridge application")
class ModelBridgeApplicationTest {

    @Autowired
    private ModelBridge modelBridge;

    @Autowired
    private ModelDocumentStore store;

    @Autowired
    private CommandDispatcher dispatcher;

    @Autowired
    private JsonMapper jsonMapper;

    @Test
    @DisplayName("startup opens the configured model and starts both channels")
    void startsWithModel() {
        assertTrue(modelBridge.isRunning());
        assertTrue(modelBridge.dataPort() > 0);
        assertTrue(modelBridge.commandPort() > 0);
        assertEquals("test-model.json", store.documentName());
        assertThat(store.allObjects()).hasSize(4);
    }

    @Test
    @DisplayName("the dispatcher is wired with every command group")
    void commandsRegistered() {
        List<String> names = new ArrayList<>();
        dispatcher.catalogue().forEach(entry -> names.add(entry.get("name").asString()));

        assertThat(names).contains("create_data_object", "create_form", "add_report_column", "add_lookup_value",
                "add_role", "update_role", "create_user_story", "update_user_story");
    }

    @Test
    @DisplayName("an unreadable model file leaves the current model in place")
    void loaderKeepsModelOnBadFile() throws Exception {
        ModelDocumentStore scratch = new ModelDocumentStore(jsonMapper);
        Path broken = Files.createTempFile("broken-model", ".json");
        Files.writeString(broken, "{ not json");
        ModelDocumentLoader loader = new ModelDocumentLoader(scratch, jsonMapper, new DefaultResourceLoader(), broken.toString());

        loader.load(broken.toString());
        loader.load(broken.resolveSibling("missing-model.json").toString());

        assertEquals(ModelDocumentStore.UNTITLED, scratch.documentName());
        Files.deleteIfExists(broken);
    }
}
