package com.haulage.tickets.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldCorrectionRequest {
    private String value;
    private String correctedBy;

    /**
     * Review entry closed by this correction, if any.
     */
    private Long reviewEntryId;
}
