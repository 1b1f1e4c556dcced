package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of submitting a download. The downloader identity fields and
 * {@code attemptedDownloaders} are only filled in by the fallback entry point.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AddResult {
    private AddOutcome outcome;
    private String id;
    private String message;

    private String downloaderId;
    private String downloaderName;
    private List<String> attemptedDownloaders;

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }

    public static AddResult added(String id, String message) {
        return AddResult.builder().outcome(AddOutcome.ADDED).id(id).message(message).build();
    }

    public static AddResult alreadyExists(String id, String message) {
        return AddResult.builder().outcome(AddOutcome.ALREADY_EXISTS).id(id).message(message).build();
    }

    public static AddResult unverified(String message) {
        return AddResult.builder().outcome(AddOutcome.ADDED_UNVERIFIED).message(message).build();
    }

    public static AddResult failed(String message) {
        return AddResult.builder().outcome(AddOutcome.FAILED).message(message).build();
    }
}
