package com.haulage.tickets.service;

import com.haulage.tickets.dto.ExtractedPage;
import com.haulage.tickets.exception.ExtractionServiceException;
import com.haulage.tickets.exception.MalformedSourceException;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for the OCR/extraction layer.
 * <p>
 * Implementations handle document rendering and text recognition; this
 * service only consumes their per-page candidates.
 */
public interface TicketExtractionClient {

    /**
     * Extracts every page of a source file.
     *
     * @param file the source file
     * @return pages in document order, never empty
     * @throws ExtractionServiceException if the extraction engine is unavailable or errors
     * @throws MalformedSourceException   if the file cannot be read as a ticket document
     */
    List<ExtractedPage> extract(Path file);

    String getEngineName();

    boolean isAvailable();
}
