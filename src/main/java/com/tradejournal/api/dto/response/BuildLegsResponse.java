package com.tradejournal.api.dto.response;

import com.tradejournal.api.dto.request.LegDto;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Canonical legs built for the requested structure, their classification, and any
 * warnings the editor should show before the user commits (e.g. short calendar).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildLegsResponse {
    private List<LegDto> legs;
    private ClassificationResponse classification;
    private List<String> warnings;
}
