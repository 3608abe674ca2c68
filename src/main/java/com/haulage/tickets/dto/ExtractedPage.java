package com.haulage.tickets.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What the extraction layer returns for one page: the raw text plus zero or
 * more named candidates. A field the OCR could not find simply has no candidate.
 */
@Value
@Builder
public class ExtractedPage {

    int pageNumber;
    String text;

    @Singular
    List<CandidateValue> candidates;
}
