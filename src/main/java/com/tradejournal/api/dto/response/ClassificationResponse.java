package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Live classification of the editor's legs together with the two preview strings.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClassificationResponse {
    private PositionType type;
    private PositionDirection direction;
    private boolean symmetric;
    private String label;
    private String sidedLabel;
    private String typeCode;
    private String legsNotation;
}
