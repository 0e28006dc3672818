package com.example.modelbridge.http;

import com.example.modelbridge.api.BridgeExceptionHandler;
import com.example.modelbridge.command.CommandDispatcher;
import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.query.ModelQueries;
import com.example.modelbridge.query.ModelSchemas;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;

/**
 * The data and command channels of one host, sharing a single {@link BridgeEventLoop} so that
 * requests from both channels are handled one at a time against the document store.
 */
@Slf4j
public class ModelBridge {

    private final BridgeEventLoop eventLoop;
    private final BridgeChannel dataChannel;
    private final BridgeChannel commandChannel;

    public ModelBridge(BridgeSettings settings, ModelDocumentStore store, ModelQueries queries, ModelSchemas schemas,
                       CommandDispatcher dispatcher, JsonMapper jsonMapper, BridgeExceptionHandler exceptionHandler) {
        this.eventLoop = new BridgeEventLoop();
        BridgeHealth health = new BridgeHealth(jsonMapper, store);
        this.dataChannel = new BridgeChannel(ChannelType.DATA, settings,
                new DataChannelController(queries, schemas, health, eventLoop), jsonMapper, exceptionHandler);
        this.commandChannel = new BridgeChannel(ChannelType.COMMAND, settings,
                new CommandChannelController(dispatcher, health, eventLoop, jsonMapper), jsonMapper, exceptionHandler);
        health.register(dataChannel);
        health.register(commandChannel);
    }

    /**
     * Starts both channels. If the command channel cannot bind, the data channel is stopped again.
     *
     * @throws BridgeStartupException when either channel exhausts its port range
     */
    public void start() {
        dataChannel.start();
        try {
            commandChannel.start();
        } catch (RuntimeException e) {
            dataChannel.stop();
            throw e;
        }
        log.info("Model bridge started dataPort={} commandPort={}", dataChannel.port(), commandChannel.port());
    }

    public void stop() {
        dataChannel.stop();
        commandChannel.stop();
        eventLoop.shutdown();
        log.info("Model bridge stopped");
    }

    public int dataPort() {
        return dataChannel.port();
    }

    public int commandPort() {
        return commandChannel.port();
    }

    public boolean isRunning() {
        return dataChannel.isRunning() && commandChannel.isRunning();
    }
}
