package com.tradejournal.mapper;

import com.tradejournal.api.dto.request.BuildLegsRequest;
import com.tradejournal.api.dto.request.LegDto;
import com.tradejournal.api.dto.response.PositionSummaryResponse;
import com.tradejournal.api.dto.response.PositionTypeResponse;
import com.tradejournal.api.dto.response.SymbolSettingsResponse;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.LegBuildRequest;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.domain.model.PositionSummary;
import com.tradejournal.domain.model.SymbolSettings;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for position DTOs <-> domain model conversions.
 *
 * <p>A null quantity on an incoming leg maps to 0, which the engine treats as a leg
 * without structure.
 */
@Mapper
public interface PositionDtoMapper {

    // Request DTO -> Domain
    PositionLeg toDomain(LegDto dto);

    List<PositionLeg> toDomainList(List<LegDto> dtos);

    @Mapping(target = "expirationPattern", ignore = true)
    LegBuildRequest toDomain(BuildLegsRequest dto);

    // Domain -> Response DTO
    LegDto toDto(PositionLeg leg);

    List<LegDto> toDtoList(List<PositionLeg> legs);

    PositionSummaryResponse toResponse(PositionSummary summary);

    SymbolSettingsResponse toResponse(SymbolSettings settings);

    default PositionTypeResponse toResponse(PositionType type) {
        return PositionTypeResponse.builder()
                .type(type)
                .label(type.getLabel())
                .code(type.getCode())
                .category(type.getCategory())
                .defaultDirection(type.getDefaultDirection())
                .timeSpread(type.isTimeSpread())
                .build();
    }
}
