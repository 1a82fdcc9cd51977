package com.netintel.wigle.exception;

/**
 * A search page could not be fetched after retries. Pages before it are already on disk.
 */
public class PageFetchException extends WigleApiException {

    private final int pageNumber;

    public PageFetchException(int pageNumber, WigleApiException cause) {
        super("Page " + pageNumber + " failed: " + cause.getMessage(), cause.getHttpStatus(), cause);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
