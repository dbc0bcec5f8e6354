package com.drawpool.connector;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskStatusTest {

    private static TaskStatus withProgress(String progress) {
        return new TaskStatus("t", "IMAGINE", "IN_PROGRESS", progress, null, null, null, null, null);
    }

    @Test
    void progressPercentParsesPercentText() {
        assertEquals(50, withProgress("50%").progressPercent());
        assertEquals(100, withProgress("100%").progressPercent());
        assertEquals(7, withProgress(" 7 ").progressPercent());
    }

    @Test
    void progressPercentTreatsMissingOrInvalidAsZero() {
        assertEquals(0, withProgress(null).progressPercent());
        assertEquals(0, withProgress("").progressPercent());
        assertEquals(0, withProgress("abc%").progressPercent());
    }

    @Test
    void firstButtonHashUsesFirstButtonOnly() {
        TaskStatus status = new TaskStatus("t", null, null, "100%", "u", null, null, null, List.of(
                new ActionButton("MJ::JOB::upsample::1::first", null, "U1", 2, 2),
                new ActionButton("MJ::JOB::upsample::2::second", null, "U2", 2, 2)));
        assertEquals("first", status.firstButtonHash().orElse(""));
        assertFalse(status.isFailed());
    }

    @Test
    void imageHashTakesFifthPartOfLongIdsAndLastPartOtherwise() {
        assertEquals("hash", ImageHashes.fromCustomId("MJ::JOB::upsample::1::hash::SOLO"));
        assertEquals("hash", ImageHashes.fromCustomId("MJ::JOB::upsample::1::hash"));
        assertEquals("only", ImageHashes.fromCustomId("only"));
        assertEquals("", ImageHashes.fromCustomId(null));
    }

    @Test
    void submitResultAcceptsSubmittedAndQueuedCodes() {
        assertTrue(new SubmitResult(1, "ok", "x").isAccepted());
        assertTrue(new SubmitResult(22, "queued", "x").isAccepted());
        assertFalse(new SubmitResult(4, "banned", "").isAccepted());
    }

    @Test
    void fullPromptAppendsParamsAndNegativePrompt() {
        DrawTask task = DrawTask.builder().prompt("castle ").params("--v 6").negPrompt("fog").build();
        assertEquals("castle --v 6 --no fog", task.fullPrompt());
        assertEquals("castle", DrawTask.builder().prompt("castle").build().fullPrompt());
    }

    @Test
    void channelNamesFollowKindPrefix() {
        assertEquals("mj-plus-service-0", ConnectorKind.PLUS.channelName(0));
        assertEquals("mj-proxy-service-3", ConnectorKind.PROXY.channelName(3));
    }
}
