package com.example.notemake_backend.service;

import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YtDlpClientTest {

    @Mock private ProcessRunner runner;

    private YtDlpClient client() {
        return new YtDlpClient(runner, new ObjectMapper(), "yt-dlp", null);
    }

    @Test
    void classifyMapsToolOutputToKinds() {
        assertThat(YtDlpClient.classify("ERROR: [youtube] abc: Video unavailable", ErrorKind.NETWORK))
                .isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(YtDlpClient.classify("ERROR: HTTP Error 429: Too Many Requests", ErrorKind.MODEL_ERROR))
                .isEqualTo(ErrorKind.NETWORK);
        assertThat(YtDlpClient.classify("Read timed out", ErrorKind.NETWORK)).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(YtDlpClient.classify("ERROR: This playlist does not exist", ErrorKind.PLAYLIST_RESOLUTION_FAILED))
                .isEqualTo(ErrorKind.PLAYLIST_RESOLUTION_FAILED);
        assertThat(YtDlpClient.classify("something odd", ErrorKind.MODEL_ERROR)).isEqualTo(ErrorKind.MODEL_ERROR);
        assertThat(YtDlpClient.classify(null, ErrorKind.NETWORK)).isEqualTo(ErrorKind.NETWORK);
    }

    @Test
    void videoInfoParsesStdout() throws Exception {
        when(runner.run(anyList(), anyLong(), any(TimeUnit.class)))
                .thenReturn(new ProcessRunner.Result(0, "{\"id\":\"dQw4w9WgXcQ\",\"title\":\"T\"}", "", false));

        JsonNode info = client().videoInfo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");

        assertThat(info.path("title").asText()).isEqualTo("T");
    }

    @Test
    @SuppressWarnings("unchecked")
    void playlistInfoPassesCap() throws Exception {
        when(runner.run(anyList(), anyLong(), any(TimeUnit.class)))
                .thenReturn(new ProcessRunner.Result(0, "{\"entries\":[]}", "", false));

        client().playlistInfo("https://www.youtube.com/playlist?list=PL1", 25);

        ArgumentCaptor<List<String>> cmd = ArgumentCaptor.forClass(List.class);
        verify(runner).run(cmd.capture(), anyLong(), any(TimeUnit.class));
        assertThat(cmd.getValue()).containsSubsequence("--playlist-end", "25");
        assertThat(cmd.getValue()).contains("--flat-playlist");
    }

    @Test
    void failedRunIsClassified() throws Exception {
        when(runner.run(anyList(), anyLong(), any(TimeUnit.class)))
                .thenReturn(new ProcessRunner.Result(1, "", "ERROR: Private video", false));

        assertThatThrownBy(() -> client().videoInfo("https://www.youtube.com/watch?v=dQw4w9WgXcQ"))
                .isInstanceOfSatisfying(PipelineException.class, ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void timedOutRunIsTimeout() throws Exception {
        when(runner.run(anyList(), anyLong(), any(TimeUnit.class)))
                .thenReturn(new ProcessRunner.Result(-1, "", "", true));

        assertThatThrownBy(() -> client().videoInfo("https://www.youtube.com/watch?v=dQw4w9WgXcQ"))
                .isInstanceOfSatisfying(PipelineException.class, ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.TIMEOUT));
    }
}
