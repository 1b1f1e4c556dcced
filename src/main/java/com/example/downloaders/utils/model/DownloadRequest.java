package com.example.downloaders.utils.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class DownloadRequest {
    /** Magnet URI, direct .torrent URL or NZB URL. */
    @NotBlank(message = "URL is required")
    private String url;

    @NotBlank(message = "Title is required")
    private String title;

    private String category;
    private String downloadPath;
    private Integer priority;
    private DownloadType downloadType;
}
