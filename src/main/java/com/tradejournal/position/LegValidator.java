package com.tradejournal.position;

import com.tradejournal.domain.model.LegViolation;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.exception.BusinessException;
import com.tradejournal.exception.ErrorCode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Field checks a leg set must pass before it is handed to storage.
 *
 * <p>The classifier accepts anything; this validator is what stops a half-edited
 * form from being saved. Rules:
 * <ul>
 *   <li>between 1 and 4 legs</li>
 *   <li>strike present and greater than 0</li>
 *   <li>expiration present</li>
 *   <li>right present</li>
 *   <li>quantity not 0</li>
 * </ul>
 * Legs are never rewritten; a valid set is returned exactly as given.
 */
@Component
public class LegValidator {

    private static final Logger log = LoggerFactory.getLogger(LegValidator.class);

    /** Returns every violation found, empty when the legs can be saved. */
    public List<LegViolation> validate(List<PositionLeg> legs) {
        List<LegViolation> violations = new ArrayList<>();
        if (legs == null || legs.isEmpty()) {
            violations.add(new LegViolation(-1, "legs", "at least one leg is required"));
            return violations;
        }
        if (legs.size() > PositionClassifier.MAX_LEGS) {
            violations.add(new LegViolation(
                    -1, "legs", "at most " + PositionClassifier.MAX_LEGS + " legs are allowed"));
        }

        for (int i = 0; i < legs.size(); i++) {
            PositionLeg leg = legs.get(i);
            if (leg == null) {
                violations.add(new LegViolation(i, "leg", "must not be null"));
                continue;
            }
            if (leg.getStrike() == null) {
                violations.add(new LegViolation(i, "strike", "is required"));
            } else if (leg.getStrike().compareTo(BigDecimal.ZERO) <= 0) {
                violations.add(new LegViolation(i, "strike", "must be greater than 0"));
            }
            if (leg.getExpiration() == null) {
                violations.add(new LegViolation(i, "expiration", "is required"));
            }
            if (leg.getRight() == null) {
                violations.add(new LegViolation(i, "right", "is required"));
            }
            if (leg.getQuantity() == 0) {
                violations.add(new LegViolation(i, "quantity", "must not be 0"));
            }
        }
        return violations;
    }

    /**
     * Returns the legs unchanged if they pass, otherwise throws with one detail entry
     * per violation keyed by its path (e.g. {@code legs[1].strike}).
     *
     * @throws BusinessException with {@link ErrorCode#VALIDATION_ERROR}
     */
    public List<PositionLeg> requireValid(List<PositionLeg> legs) {
        List<LegViolation> violations = validate(legs);
        if (violations.isEmpty()) {
            return legs;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        for (LegViolation violation : violations) {
            details.put(violation.getPath(), violation.getMessage());
        }
        log.debug("Rejected leg set with {} violations: {}", violations.size(), details.keySet());
        throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Position legs are not valid", details);
    }
}
