package com.tradejournal.api.dto.request;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A symbol plus the legs currently in the position editor.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LegSetRequest {

    /** Optional; only used for display fields and symbol defaults. */
    private String symbol;

    private List<LegDto> legs;
}
