package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DownloadDetails extends DownloadStatus {
    private String hash;
    private Instant addedDate;
    private Instant completedDate;
    private String downloadDir;
    private String comment;
    private String creator;

    @Builder.Default
    private List<DownloadFile> files = new ArrayList<>();
    @Builder.Default
    private List<DownloadTracker> trackers = new ArrayList<>();

    private Integer totalPeers;
    private Integer connectedPeers;
}
