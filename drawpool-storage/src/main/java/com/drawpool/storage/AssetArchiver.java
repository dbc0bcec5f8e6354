package com.drawpool.storage;

/**
 * Copies a remote asset into storage we control.
 */
public interface AssetArchiver {

    /**
     * Fetches {@code sourceUrl} and stores it with the given visibility.
     *
     * @return URL under which the archived copy is served
     * @throws ArchiveException when the source cannot be fetched or the copy cannot be written
     */
    String archive(String sourceUrl, AssetAccess access) throws ArchiveException;
}
