package com.jamra.offline.ipc;

import com.google.gson.JsonParseException;
import com.jamra.offline.service.event.ConsolidatedEvent;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerProtocolTest {

    @Test
    void framesWithoutAStringTypeAreRejected() {
        assertThatThrownBy(() -> WorkerProtocol.decodeRequest("[1,2]"))
                .isInstanceOf(JsonParseException.class)
                .hasMessage("Frame is not a JSON object");
        assertThatThrownBy(() -> WorkerProtocol.decodeMessage("{\"type\":7}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessage("Frame has no type");
    }

    @Test
    void requestKeepsItsPayloadAsATree() {
        WorkerRequest request = WorkerProtocol.decodeRequest(
                "{\"type\":\"delete-chapter\",\"requestId\":\"9\",\"payload\":{\"mangaId\":\"m1\",\"chapterId\":\"c1\"}}");

        assertThat(request.getType()).isEqualTo("delete-chapter");
        assertThat(request.getRequestId()).isEqualTo("9");
        assertThat(request.getPayload().getAsJsonObject().get("chapterId").getAsString()).isEqualTo("c1");
    }

    @Test
    void envelopeIsRestoredFromItsDiscriminator() {
        ConsolidatedEvent.SystemUpdate system = new ConsolidatedEvent.SystemUpdate("cleanup-performed", 4096, 3);
        ConsolidatedEvent.ContentUpdate content = new ConsolidatedEvent.ContentUpdate(List.of(
                new ConsolidatedEvent.ContentItem("new-chapters", "m1", null, 2)));

        assertThat(WorkerProtocol.decodeEnvelope(WorkerProtocol.toTree(system))).isEqualTo(system);
        assertThat(WorkerProtocol.decodeEnvelope(WorkerProtocol.toTree(content))).isEqualTo(content);
        assertThat(WorkerProtocol.decodeEnvelope(WorkerProtocol.toTree(Map.of("items", List.of())))).isNull();
        assertThat(WorkerProtocol.decodeEnvelope(null)).isNull();
    }

    @Test
    void stdoutChannelWritesOneCompactLinePerFrame() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        StdoutWorkerChannel channel = new StdoutWorkerChannel(buffer);

        channel.send(WorkerMessage.lifecycle(WorkerMessage.READY, null, 5L));
        channel.send(WorkerMessage.lifecycle(WorkerMessage.STOPPED, "2", 6L));
        channel.send(WorkerMessage.result("3", WorkerCommandType.GET_DOWNLOADED_MANGA,
                WorkerProtocol.toTree(Map.of("title", "俺だけレベルアップな件 나 혼자만 레벨업"))));

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).isEqualTo("{\"type\":\"ready\",\"timestamp\":5}");
        assertThat(WorkerProtocol.decodeMessage(lines[1]).getRequestId()).isEqualTo("2");
        assertThat(WorkerProtocol.decodeMessage(lines[2]).getResult().getAsJsonObject().get("title").getAsString())
                .isEqualTo("俺だけレベルアップな件 나 혼자만 레벨업");
    }

    @Test
    void launcherPassesSettingsAsSortedSpringProperties() {
        ProcessWorkerLauncher launcher = new ProcessWorkerLauncher(Map.of(
                "offline.worker.ipc-enabled", "true",
                "offline.data-dir", "/data"));

        List<String> command = launcher.command();

        assertThat(command).contains("-cp", ProcessWorkerLauncher.MAIN_CLASS);
        assertThat(command.subList(command.size() - 2, command.size()))
                .containsExactly("--offline.data-dir=/data", "--offline.worker.ipc-enabled=true");
    }
}
