package com.example.notemake_backend.service.playlist;

import com.example.notemake_backend.dto.pipeline.PlaylistEntry;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.exception.PlaylistResolutionFailedException;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YtDlpPlaylistResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock private YtDlpClient ytDlp;

    @Test
    void entriesKeepOrderAndFlagUnavailableVideos() throws Exception {
        when(ytDlp.playlistInfo("https://www.youtube.com/playlist?list=PL1", 0)).thenReturn(mapper.readTree("""
                {"entries":[
                  {"id":"aaaaaaaaaaa","title":"One"},
                  {"id":"bbbbbbbbbbb","title":"[Private video]"},
                  {"id":"ccccccccccc","title":"Three","availability":"needs_auth"},
                  {"id":"UC_channel_tab","title":"tab"},
                  {"id":"ddddddddddd","title":"Four"}
                ]}"""));

        List<PlaylistEntry> entries = new YtDlpPlaylistResolver(ytDlp)
                .expand("https://www.youtube.com/watch?v=aaaaaaaaaaa&list=PL1", 0);

        assertThat(entries).extracting(PlaylistEntry::videoId)
                .containsExactly("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc", "ddddddddddd");
        assertThat(entries).extracting(PlaylistEntry::available).containsExactly(true, false, false, true);
    }

    @Test
    void channelTabsAreFlattenedAndCapped() throws Exception {
        String channel = "https://www.youtube.com/@BackendWeekly";
        when(ytDlp.playlistInfo(channel, 2)).thenReturn(mapper.readTree("""
                {"entries":[
                  {"title":"Videos","entries":[{"id":"aaaaaaaaaaa","title":"One"},{"id":"bbbbbbbbbbb","title":"Two"}]},
                  {"title":"Shorts","entries":[{"id":"ccccccccccc","title":"Three"}]}
                ]}"""));

        List<PlaylistEntry> entries = new YtDlpPlaylistResolver(ytDlp).expand(channel, 2);

        assertThat(entries).extracting(PlaylistEntry::videoId).containsExactly("aaaaaaaaaaa", "bbbbbbbbbbb");
    }

    @Test
    void emptyPlaylistFails() throws Exception {
        when(ytDlp.playlistInfo(anyString(), anyInt())).thenReturn(mapper.readTree("{\"entries\":[]}"));

        assertThatThrownBy(() -> new YtDlpPlaylistResolver(ytDlp).expand("https://www.youtube.com/playlist?list=PL1", 0))
                .isInstanceOf(PlaylistResolutionFailedException.class);
    }

    @Test
    void toolFailureBecomesResolutionFailure() {
        when(ytDlp.playlistInfo(anyString(), anyInt()))
                .thenThrow(new PipelineException(ErrorKind.NETWORK, "offline"));

        assertThatThrownBy(() -> new YtDlpPlaylistResolver(ytDlp).expand("https://www.youtube.com/playlist?list=PL1", 0))
                .isInstanceOfSatisfying(PlaylistResolutionFailedException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ErrorKind.PLAYLIST_RESOLUTION_FAILED));
    }

    @Test
    void nonPlaylistReferenceIsRejected() {
        assertThatThrownBy(() -> YtDlpPlaylistResolver.toUrl("https://youtu.be/aaaaaaaaaaa"))
                .isInstanceOf(PlaylistResolutionFailedException.class);
    }
}
