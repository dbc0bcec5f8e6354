package com.drawpool.connector.plus;

import com.drawpool.config.ChannelConfig;
import com.drawpool.connector.ConnectorException;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.DrawTask;
import com.drawpool.connector.HttpConnectorSupport;
import com.drawpool.connector.SubmitResult;

import java.net.http.HttpClient;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connector for MidJourney-Plus style APIs.
 * Submissions go to {@code <apiUrl>/mj-<mode>/mj/submit/...} with {@code Authorization: Bearer <apiKey>};
 * upscale and variation are sent as button actions ({@code MJ::JOB::upsample::<index>::<hash>}).
 */
public final class PlusConnector extends HttpConnectorSupport {

    private static final String BOT_TYPE = "MID_JOURNEY";

    private final String mode;

    public PlusConnector(ChannelConfig channel) {
        this(channel, null);
    }

    public PlusConnector(ChannelConfig channel, HttpClient httpClient) {
        super(channel.getApiUrl(), channel.getApiKey(), httpClient);
        this.mode = channel.getMode();
    }

    @Override
    public ConnectorKind kind() {
        return ConnectorKind.PLUS;
    }

    @Override
    protected String[] authHeader() {
        return new String[]{"Authorization", "Bearer " + apiKey};
    }

    @Override
    public SubmitResult submit(DrawTask task) throws ConnectorException {
        switch (task.getType()) {
            case IMAGE:
                return imagine(task);
            case UPSCALE:
                return action(task, "upsample");
            case VARIATION:
                return action(task, "variation");
            case BLEND:
                return blend(task);
            case SWAP_FACE:
                return swapFace(task);
            default:
                throw new ConnectorException("Unsupported task type: " + task.getType());
        }
    }

    private SubmitResult imagine(DrawTask task) throws ConnectorException {
        Map<String, Object> body = new HashMap<>();
        body.put("botType", BOT_TYPE);
        body.put("prompt", task.fullPrompt());
        body.put("base64Array", toDataUris(task.getImgArr()));
        return postSubmit(submitUrl("imagine"), body);
    }

    private SubmitResult action(DrawTask task, String action) throws ConnectorException {
        Map<String, Object> body = new HashMap<>();
        body.put("customId", "MJ::JOB::" + action + "::" + task.getIndex() + "::" + task.getMessageHash());
        body.put("taskId", task.getMessageId());
        return postSubmit(submitUrl("action"), body);
    }

    private SubmitResult blend(DrawTask task) throws ConnectorException {
        if (task.getImgArr().size() < 2) {
            throw new ConnectorException("Blend needs at least 2 images, got " + task.getImgArr().size());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("botType", BOT_TYPE);
        body.put("dimensions", "SQUARE");
        body.put("base64Array", toDataUris(task.getImgArr()));
        return postSubmit(submitUrl("blend"), body);
    }

    private SubmitResult swapFace(DrawTask task) throws ConnectorException {
        List<String> images = task.getImgArr();
        if (images.size() != 2) {
            throw new ConnectorException("Face swap needs exactly 2 images, got " + images.size());
        }
        Map<String, Object> body = new HashMap<>();
        body.put("sourceBase64", toDataUri(images.get(0)));
        body.put("targetBase64", toDataUri(images.get(1)));
        return postSubmit(apiUrl + "/mj-" + mode + "/mj/insight-face/swap", body);
    }

    private String submitUrl(String endpoint) {
        return apiUrl + "/mj-" + mode + "/mj/submit/" + endpoint;
    }
}
