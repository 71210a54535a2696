package com.example.notemake_backend.service;

import com.example.notemake_backend.dto.pipeline.ExtractionOptions;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.engine.Interfaces.CaptionEngine;
import com.example.notemake_backend.engine.Interfaces.TranscriptionEngine;
import com.example.notemake_backend.exception.ExtractionFailedException;
import com.example.notemake_backend.exception.NoCaptionsException;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.AudioTask;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionStrategyTest {

    @Mock private CaptionEngine captions;
    @Mock private TranscriptionEngine audio;

    private ExtractionStrategy strategy;

    @BeforeEach
    void setUp() {
        RetryPolicy retry = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2));
        strategy = new ExtractionStrategy(captions, audio, retry, TimeLimiter.direct(), Duration.ZERO, Duration.ZERO);
    }

    @Test
    void captionsWinWhenAvailable() {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ", "en");
        when(captions.fetch(ref, "en")).thenReturn(Transcripts.sample(ExtractionMode.CAPTIONS));

        TranscriptResult result = strategy.extract(ref, ExtractionOptions.defaults());

        assertThat(result.sourceMode()).isEqualTo(ExtractionMode.CAPTIONS);
        verifyNoInteractions(audio);
    }

    @Test
    void transientCaptionFailuresAreRetriedWithBackoff() {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ");
        when(captions.fetch(ref, null))
                .thenThrow(new PipelineException(ErrorKind.NETWORK, "reset"))
                .thenThrow(new PipelineException(ErrorKind.TIMEOUT, "slow"))
                .thenReturn(Transcripts.sample(ExtractionMode.CAPTIONS));

        TranscriptResult result = strategy.extract(ref, ExtractionOptions.defaults());

        assertThat(result.sourceMode()).isEqualTo(ExtractionMode.CAPTIONS);
        verify(captions, times(3)).fetch(ref, null);
    }

    @Test
    void exhaustedTransientFailuresFallBackToAudioWhenAllowed() throws Exception {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ");
        when(captions.fetch(ref, null)).thenThrow(new PipelineException(ErrorKind.NETWORK, "down"));
        when(audio.transcribe(any())).thenReturn(Transcripts.sample(ExtractionMode.AUDIO));

        TranscriptResult result = strategy.extract(ref, ExtractionOptions.defaults());

        assertThat(result.sourceMode()).isEqualTo(ExtractionMode.AUDIO);
        verify(captions, times(3)).fetch(ref, null);
    }

    @Test
    void exhaustedTransientFailuresFailWhenFallbackDisabled() throws Exception {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ");
        when(captions.fetch(ref, null)).thenThrow(new PipelineException(ErrorKind.NETWORK, "down"));

        assertThatThrownBy(() -> strategy.extract(ref, new ExtractionOptions(false, "base", AudioTask.TRANSCRIBE)))
                .isInstanceOfSatisfying(ExtractionFailedException.class,
                        ex -> assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.NETWORK));
        verify(audio, never()).transcribe(any());
    }

    @Test
    void noCaptionsFallsBackWithoutRetry() throws Exception {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ", "de");
        when(captions.fetch(ref, "de")).thenThrow(new NoCaptionsException("dQw4w9WgXcQ", "de"));
        when(audio.transcribe(any())).thenReturn(Transcripts.sample(ExtractionMode.AUDIO));

        strategy.extract(ref, new ExtractionOptions(true, "small", AudioTask.TRANSLATE));

        verify(captions, times(1)).fetch(ref, "de");
        ArgumentCaptor<TranscriptionEngine.Request> request = ArgumentCaptor.forClass(TranscriptionEngine.Request.class);
        verify(audio).transcribe(request.capture());
        assertThat(request.getValue().modelSize()).isEqualTo("small");
        assertThat(request.getValue().task()).isEqualTo(AudioTask.TRANSLATE);
        assertThat(request.getValue().langHint()).isEqualTo("de");
    }

    @Test
    void pinnedCaptionsNeverUseAudio() throws Exception {
        VideoRef ref = new VideoRef("dQw4w9WgXcQ", null, ExtractionMode.CAPTIONS);
        when(captions.fetch(ref, null)).thenThrow(new NoCaptionsException("dQw4w9WgXcQ", null));

        assertThatThrownBy(() -> strategy.extract(ref, ExtractionOptions.defaults()))
                .isInstanceOfSatisfying(ExtractionFailedException.class,
                        ex -> assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.NO_CAPTIONS));
        verify(audio, never()).transcribe(any());
    }

    @Test
    void pinnedAudioSkipsCaptions() throws Exception {
        VideoRef ref = new VideoRef("dQw4w9WgXcQ", null, ExtractionMode.AUDIO);
        when(audio.transcribe(any())).thenReturn(Transcripts.sample(ExtractionMode.AUDIO));

        assertThat(strategy.extract(ref, ExtractionOptions.defaults()).sourceMode()).isEqualTo(ExtractionMode.AUDIO);
        verifyNoInteractions(captions);
    }

    @Test
    void audioFailureIsTerminalAndKeepsCauseKind() throws Exception {
        VideoRef ref = new VideoRef("dQw4w9WgXcQ", null, ExtractionMode.AUDIO);
        when(audio.transcribe(any())).thenThrow(new OutOfMemoryError("heap"));

        assertThatThrownBy(() -> strategy.extract(ref, ExtractionOptions.defaults()))
                .isInstanceOfSatisfying(ExtractionFailedException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.EXTRACTION_FAILED);
                    assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.RESOURCE_EXHAUSTED);
                });
        verify(audio, times(1)).transcribe(any());
    }

    @Test
    void nonTransientCaptionFailureIsTerminal() throws Exception {
        VideoRef ref = VideoRef.of("dQw4w9WgXcQ");
        when(captions.fetch(ref, null)).thenThrow(new PipelineException(ErrorKind.NOT_FOUND, "gone"));

        assertThatThrownBy(() -> strategy.extract(ref, ExtractionOptions.defaults()))
                .isInstanceOfSatisfying(ExtractionFailedException.class,
                        ex -> assertThat(ex.getCauseKind()).isEqualTo(ErrorKind.NOT_FOUND));
        verify(captions, times(1)).fetch(ref, null);
        verify(audio, never()).transcribe(any());
    }
}
