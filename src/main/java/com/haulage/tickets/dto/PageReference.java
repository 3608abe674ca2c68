package com.haulage.tickets.dto;

import lombok.Value;

/**
 * Identifies one page of one source file.
 */
@Value(staticConstructor = "of")
public class PageReference {

    String sourceFile;
    int pageNumber;

    public String pageId() {
        return sourceFile + "#page" + pageNumber;
    }

    @Override
    public String toString() {
        return pageId();
    }
}
