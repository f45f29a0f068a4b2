package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.PositionCategory;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One entry of the position type picker.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionTypeResponse {
    private PositionType type;
    private String label;
    private String code;
    private PositionCategory category;
    private PositionDirection defaultDirection;

    /** True for calendar and diagonal; selecting SHORT for these raises a warning. */
    private boolean timeSpread;
}
