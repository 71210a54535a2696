package com.example.notemake_backend.dto.pipeline;

import java.util.List;

public record ProcessingOptions(
        boolean detectParagraphs,
        double paragraphPauseSec,
        boolean removeFillers,
        List<String> customFillers,
        boolean fixCapitalization,
        boolean improvePunctuation,
        boolean cleanArtifacts,
        int keywordCount,
        int summaryPoints
) {

    public ProcessingOptions {
        customFillers = customFillers == null ? List.of() : List.copyOf(customFillers);
        paragraphPauseSec = paragraphPauseSec <= 0 ? 2.0 : paragraphPauseSec;
        keywordCount = Math.max(0, keywordCount);
        summaryPoints = Math.max(0, summaryPoints);
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(true, 2.0, false, List.of(), false, false, true, 10, 5);
    }
}
