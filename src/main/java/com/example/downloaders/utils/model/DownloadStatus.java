package com.example.downloaders.utils.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DownloadStatus {
    private String id;
    private String name;
    private DownloadState status;
    /** 0-100. */
    private int progress;
    /** Bytes per second. */
    private Long downloadSpeed;
    private Long uploadSpeed;
    /** Seconds. */
    private Long eta;
    private Long size;
    private Long downloaded;

    private Integer seeders;
    private Integer leechers;
    private Double ratio;

    private RepairStatus repairStatus;
    private UnpackStatus unpackStatus;
    /** Age of the post in days. */
    private Integer age;

    private String category;
    private String error;
}
