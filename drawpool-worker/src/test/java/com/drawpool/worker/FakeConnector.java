package com.drawpool.worker;

import com.drawpool.connector.ActionButton;
import com.drawpool.connector.ConnectorException;
import com.drawpool.connector.ConnectorKind;
import com.drawpool.connector.DrawTask;
import com.drawpool.connector.ProviderConnector;
import com.drawpool.connector.SubmitResult;
import com.drawpool.connector.TaskStatus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Scripted connector: returns the configured submit result / status, or throws when told to. */
public class FakeConnector implements ProviderConnector {

    private final ConnectorKind kind;
    private final List<DrawTask> submitted = new CopyOnWriteArrayList<>();
    private final List<String> queried = new CopyOnWriteArrayList<>();
    private volatile SubmitResult submitResult = new SubmitResult(1, "Submit success", "task-1");
    private volatile ConnectorException submitError;
    private volatile TaskStatus status = status("0%", "", "", null);
    private volatile ConnectorException queryError;

    public FakeConnector() {
        this(ConnectorKind.PLUS);
    }

    public FakeConnector(ConnectorKind kind) {
        this.kind = kind;
    }

    public static TaskStatus status(String progress, String imageUrl, String failReason, String buttonCustomId) {
        List<ActionButton> buttons = buttonCustomId == null ? List.of()
                : List.of(new ActionButton(buttonCustomId, "", "U1", 2, 2));
        return new TaskStatus("task-1", "IMAGINE", "IN_PROGRESS", progress, imageUrl, "raw prompt", "english prompt",
                failReason, buttons);
    }

    public FakeConnector answering(SubmitResult result) {
        this.submitResult = result;
        this.submitError = null;
        return this;
    }

    public FakeConnector failingSubmit(String message) {
        this.submitError = new ConnectorException(message);
        return this;
    }

    public FakeConnector reporting(TaskStatus status) {
        this.status = status;
        this.queryError = null;
        return this;
    }

    public FakeConnector failingQuery(String message) {
        this.queryError = new ConnectorException(message);
        return this;
    }

    public List<DrawTask> getSubmitted() {
        return submitted;
    }

    public List<String> getQueried() {
        return queried;
    }

    @Override
    public ConnectorKind kind() {
        return kind;
    }

    @Override
    public SubmitResult submit(DrawTask task) throws ConnectorException {
        submitted.add(task);
        if (submitError != null) {
            throw submitError;
        }
        return submitResult;
    }

    @Override
    public TaskStatus query(String taskId) throws ConnectorException {
        queried.add(taskId);
        if (queryError != null) {
            throw queryError;
        }
        return status;
    }
}
