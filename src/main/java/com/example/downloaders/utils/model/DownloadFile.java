package com.example.downloaders.utils.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadFile {
    private String name;
    private long size;
    private int progress;
    private FilePriority priority;
    private boolean wanted;
}
