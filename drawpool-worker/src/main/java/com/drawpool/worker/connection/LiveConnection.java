package com.drawpool.worker.connection;

import java.io.IOException;

/** Push channel to one connected client (typically a websocket session owned by the HTTP layer). */
public interface LiveConnection {

    void send(byte[] payload) throws IOException;
}
