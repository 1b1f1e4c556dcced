package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DownloadTracker {
    private String url;
    private int tier;
    private TrackerStatus status;
    private Integer seeders;
    private Integer leechers;
    private Instant lastAnnounce;
    private Instant nextAnnounce;
    private String error;
}
