package com.drawpool.connector.proxy;

import com.drawpool.config.ChannelConfig;
import com.drawpool.connector.ConnectorException;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.DrawTask;
import com.drawpool.connector.HttpConnectorSupport;
import com.drawpool.connector.SubmitResult;

import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.Map;

/**
 * Connector for self-hosted midjourney-proxy servers.
 * Uses {@code <apiUrl>/mj/submit/...} with the {@code mj-api-secret} header. Face swap is not offered.
 */
public final class ProxyConnector extends HttpConnectorSupport {

    public ProxyConnector(ChannelConfig channel) {
        this(channel, null);
    }

    public ProxyConnector(ChannelConfig channel, HttpClient httpClient) {
        super(channel.getApiUrl(), channel.getApiKey(), httpClient);
    }

    @Override
    public ConnectorKind kind() {
        return ConnectorKind.PROXY;
    }

    @Override
    protected String[] authHeader() {
        return new String[]{"mj-api-secret", apiKey};
    }

    @Override
    public SubmitResult submit(DrawTask task) throws ConnectorException {
        Map<String, Object> body = new HashMap<>();
        switch (task.getType()) {
            case IMAGE:
                body.put("prompt", task.fullPrompt());
                body.put("base64Array", toDataUris(task.getImgArr()));
                return postSubmit(apiUrl + "/mj/submit/imagine", body);
            case UPSCALE:
            case VARIATION:
                body.put("action", task.getType().name());
                body.put("index", task.getIndex());
                body.put("taskId", task.getMessageId());
                return postSubmit(apiUrl + "/mj/submit/change", body);
            case BLEND:
                if (task.getImgArr().size() < 2) {
                    throw new ConnectorException("Blend needs at least 2 images, got " + task.getImgArr().size());
                }
                body.put("dimensions", "SQUARE");
                body.put("base64Array", toDataUris(task.getImgArr()));
                return postSubmit(apiUrl + "/mj/submit/blend", body);
            default:
                throw new ConnectorException("Task type " + task.getType() + " is not supported by the proxy API");
        }
    }
}
