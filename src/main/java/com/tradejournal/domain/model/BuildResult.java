package com.tradejournal.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical legs produced for an editor request, their classification and the
 * warnings to surface before the user accepts them.
 */
@Value
@Builder
public class BuildResult {

    List<PositionLeg> legs;
    PositionClassification classification;
    List<String> warnings;
}
