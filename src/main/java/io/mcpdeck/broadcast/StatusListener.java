package io.mcpdeck.broadcast;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * A live subscriber to status pushes. A send that throws removes the listener.
 */
public interface StatusListener {
    String id();

    void send(JsonNode payload) throws IOException;
}
