package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadDetails;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadStatus;

import java.util.List;
import java.util.Optional;

/**
 * One download client endpoint, spoken to in its native protocol.
 * <p>
 * Implementations keep per-instance session state (token, cookie) and are not
 * thread-safe; create one per logical operation.
 */
public interface DownloaderClient {

    /** Never throws; a failed probe is reported in the result. */
    ActionResult testConnection();

    /**
     * Submits a magnet URI, torrent URL or NZB URL. A download the client
     * already has is reported as {@link com.example.downloaders.utils.model.AddOutcome#ALREADY_EXISTS}.
     */
    AddResult addDownload(DownloadRequest request) throws DownloaderException;

    Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException;

    Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException;

    List<DownloadStatus> getAllDownloads() throws DownloaderException;

    ActionResult pauseDownload(String id) throws DownloaderException;

    ActionResult resumeDownload(String id) throws DownloaderException;

    ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException;

    /** Free bytes in the client's download location, 0 when unknown. */
    long getFreeSpace() throws DownloaderException;
}
