package com.tradejournal.position;

import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.BuildResult;
import com.tradejournal.domain.model.LegBuildRequest;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.domain.model.SymbolSettings;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.ErrorCode;
import com.tradejournal.symbol.SymbolConfigRegistry;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Backs the position editor: fills in symbol defaults before building canonical
 * legs, and runs the save-time checks on the legs the user ends up with.
 *
 * <p>On save the raw legs are returned untouched. They are never replaced by a
 * rebuilt canonical version, even when the classification matches a named type.
 */
@Service
public class PositionEditorService {

    private static final Logger log = LoggerFactory.getLogger(PositionEditorService.class);

    private final CanonicalLegBuilder canonicalLegBuilder;
    private final PositionClassifier positionClassifier;
    private final LegValidator legValidator;
    private final SymbolConfigRegistry symbolConfigRegistry;

    public PositionEditorService(
            CanonicalLegBuilder canonicalLegBuilder,
            PositionClassifier positionClassifier,
            LegValidator legValidator,
            SymbolConfigRegistry symbolConfigRegistry) {
        this.canonicalLegBuilder = canonicalLegBuilder;
        this.positionClassifier = positionClassifier;
        this.legValidator = legValidator;
        this.symbolConfigRegistry = symbolConfigRegistry;
    }

    /**
     * Builds canonical legs for the request, resolving missing anchors from the
     * symbol's settings:
     * <ul>
     *   <li>base strike: spot price rounded to the strike increment</li>
     *   <li>width: the symbol's default width</li>
     *   <li>far expiration pattern: the symbol's expiration pattern</li>
     * </ul>
     *
     * @throws BusinessException if neither base strike nor spot price is given
     */
    public BuildResult build(LegBuildRequest request, String symbol, BigDecimal spotPrice) {
        SymbolSettings settings = symbolConfigRegistry.resolve(symbol);

        BigDecimal baseStrike = request.getBaseStrike();
        if (baseStrike == null) {
            if (spotPrice == null) {
                throw new BusinessException(
                        ErrorCode.VALIDATION_ERROR,
                        "Base strike or spot price is required",
                        Map.of("baseStrike", "is required when spotPrice is absent"));
            }
            baseStrike = canonicalLegBuilder.roundToIncrement(spotPrice, settings.getStrikeIncrement());
        }

        LegBuildRequest resolved = LegBuildRequest.builder()
                .type(request.getType())
                .baseStrike(baseStrike)
                .width(request.getWidth() != null ? request.getWidth() : settings.getDefaultWidth())
                .upperWidth(request.getUpperWidth())
                .expiration(request.getExpiration())
                .farExpiration(request.getFarExpiration())
                .right(request.getRight())
                .direction(canonicalLegBuilder.resolveDirection(request.getType(), request.getDirection()))
                .expirationPattern(request.getExpirationPattern() != null
                        ? request.getExpirationPattern()
                        : settings.getExpirationPattern())
                .build();

        List<PositionLeg> legs = canonicalLegBuilder.build(resolved);
        List<String> warnings = canonicalLegBuilder.warningsFor(resolved.getType(), resolved.getDirection());
        if (!warnings.isEmpty()) {
            log.info("Built {} {} for {} with warnings: {}",
                    resolved.getDirection(), resolved.getType(), settings.getSymbol(), warnings);
        }

        return BuildResult.builder()
                .legs(legs)
                .classification(positionClassifier.classify(legs))
                .warnings(warnings)
                .build();
    }

    /**
     * Validates the legs for saving and returns them exactly as given.
     *
     * @throws BusinessException with per-field details when a leg is incomplete
     */
    public List<PositionLeg> prepareForSave(List<PositionLeg> legs) {
        List<PositionLeg> valid = legValidator.requireValid(legs);
        if (positionClassifier.classify(valid).getType() == PositionType.CUSTOM) {
            log.debug("Saving {} legs as a custom structure", valid.size());
        }
        return valid;
    }
}
