package com.tradejournal.api.controller;

import com.tradejournal.api.dto.request.BuildLegsRequest;
import com.tradejournal.api.dto.request.LegSetRequest;
import com.tradejournal.api.dto.response.BuildLegsResponse;
import com.tradejournal.api.dto.response.ClassificationResponse;
import com.tradejournal.api.dto.response.PositionSummaryResponse;
import com.tradejournal.api.dto.response.PositionTypeResponse;
import com.tradejournal.api.dto.response.SymbolSettingsResponse;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.BuildResult;
import com.tradejournal.domain.model.PositionClassification;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.mapper.PositionDtoMapper;
import com.tradejournal.position.PositionClassifier;
import com.tradejournal.position.PositionEditorService;
import com.tradejournal.position.PositionFormatter;
import com.tradejournal.position.PositionSummaryService;
import com.tradejournal.symbol.SymbolConfigRegistry;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API behind the position editor: live classification of the legs being
 * edited, canonical leg construction, display summaries and save-time validation.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/positions/classify} -- classify legs, with label and notation</li>
 *   <li>{@code POST /api/positions/build} -- build canonical legs for a type</li>
 *   <li>{@code POST /api/positions/summary} -- derived display view of legs</li>
 *   <li>{@code POST /api/positions/validate} -- save-time validation; echoes the raw legs</li>
 *   <li>{@code GET /api/positions/types} -- position type catalogue</li>
 *   <li>{@code GET /api/positions/symbols/{symbol}} -- resolved symbol settings</li>
 * </ul>
 *
 * <p>None of these endpoints persist anything.
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionClassifier positionClassifier;
    private final PositionFormatter positionFormatter;
    private final PositionSummaryService positionSummaryService;
    private final PositionEditorService positionEditorService;
    private final SymbolConfigRegistry symbolConfigRegistry;

    private final PositionDtoMapper positionDtoMapper = Mappers.getMapper(PositionDtoMapper.class);

    public PositionController(
            PositionClassifier positionClassifier,
            PositionFormatter positionFormatter,
            PositionSummaryService positionSummaryService,
            PositionEditorService positionEditorService,
            SymbolConfigRegistry symbolConfigRegistry) {
        this.positionClassifier = positionClassifier;
        this.positionFormatter = positionFormatter;
        this.positionSummaryService = positionSummaryService;
        this.positionEditorService = positionEditorService;
        this.symbolConfigRegistry = symbolConfigRegistry;
    }

    // ========================
    // EDITOR PREVIEW
    // ========================

    @PostMapping("/classify")
    public ClassificationResponse classify(@RequestBody LegSetRequest request) {
        List<PositionLeg> legs = positionDtoMapper.toDomainList(request.getLegs());
        return toClassificationResponse(positionClassifier.classify(legs), legs);
    }

    @PostMapping("/build")
    public BuildLegsResponse build(@RequestBody @Valid BuildLegsRequest request) {
        BuildResult result = positionEditorService.build(
                positionDtoMapper.toDomain(request), request.getSymbol(), request.getSpotPrice());
        return BuildLegsResponse.builder()
                .legs(positionDtoMapper.toDtoList(result.getLegs()))
                .classification(toClassificationResponse(result.getClassification(), result.getLegs()))
                .warnings(result.getWarnings())
                .build();
    }

    @PostMapping("/summary")
    public PositionSummaryResponse summary(@RequestBody LegSetRequest request) {
        List<PositionLeg> legs = positionDtoMapper.toDomainList(request.getLegs());
        return positionDtoMapper.toResponse(positionSummaryService.summarize(request.getSymbol(), legs));
    }

    @PostMapping("/validate")
    public PositionSummaryResponse validate(@RequestBody LegSetRequest request) {
        List<PositionLeg> legs = positionEditorService.prepareForSave(
                positionDtoMapper.toDomainList(request.getLegs()));
        return positionDtoMapper.toResponse(positionSummaryService.summarize(request.getSymbol(), legs));
    }

    // ========================
    // REFERENCE DATA
    // ========================

    @GetMapping("/types")
    public List<PositionTypeResponse> getTypes() {
        return Arrays.stream(PositionType.values())
                .map(positionDtoMapper::toResponse)
                .toList();
    }

    @GetMapping("/symbols/{symbol}")
    public SymbolSettingsResponse getSymbolSettings(@PathVariable String symbol) {
        return positionDtoMapper.toResponse(symbolConfigRegistry.resolve(symbol));
    }

    private ClassificationResponse toClassificationResponse(
            PositionClassification classification, List<PositionLeg> legs) {
        return ClassificationResponse.builder()
                .type(classification.getType())
                .direction(classification.getDirection())
                .symmetric(classification.isSymmetric())
                .label(positionFormatter.formatPositionLabel(
                        classification.getType(), classification.getDirection(), legs))
                .sidedLabel(positionFormatter.formatSidedLabel(
                        classification.getType(), classification.getDirection(), legs))
                .typeCode(positionFormatter.typeCode(classification.getType()))
                .legsNotation(positionFormatter.formatLegsDisplay(legs))
                .build();
    }
}
