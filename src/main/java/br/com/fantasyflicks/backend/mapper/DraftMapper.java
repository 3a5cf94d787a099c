package br.com.fantasyflicks.backend.mapper;

import br.com.fantasyflicks.backend.domain.model.DraftSession;
import br.com.fantasyflicks.backend.domain.model.Selection;
import br.com.fantasyflicks.backend.domain.model.StandingEntry;
import br.com.fantasyflicks.backend.dto.DraftSessionDTO;
import br.com.fantasyflicks.backend.dto.SelectionDTO;
import br.com.fantasyflicks.backend.dto.StandingEntryDTO;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DraftMapper {

    DraftMapper INSTANCE = Mappers.getMapper(DraftMapper.class);

    @Mapping(target = "leagueId", source = "configuration.leagueId")
    @Mapping(target = "commissionerId", source = "configuration.commissionerId")
    @Mapping(target = "poolId", source = "configuration.poolId")
    @Mapping(target = "order", source = "configuration.order")
    @Mapping(target = "discipline", source = "configuration.discipline")
    @Mapping(target = "roundsTotal", source = "configuration.roundsTotal")
    @Mapping(target = "totalPicks", expression = "java(session.getConfiguration().totalPicks())")
    @Mapping(target = "turnBudgetSeconds", source = "configuration.turnBudgetSeconds")
    @Mapping(target = "eligibilityMode", source = "configuration.eligibilityMode")
    @Mapping(target = "categoryStyle", source = "configuration.categoryStyle")
    @Mapping(target = "fallbackPolicy", source = "configuration.fallbackPolicy")
    @Mapping(target = "currentRound", ignore = true) // Calculado pelo serviço
    @Mapping(target = "remainingSeconds", ignore = true) // Calculado pelo serviço
    @Mapping(target = "timerState", ignore = true) // Calculado pelo serviço
    @Mapping(target = "activeCategory", ignore = true) // Calculado pelo serviço
    DraftSessionDTO toDTO(DraftSession session);

    SelectionDTO toDTO(Selection selection);

    List<SelectionDTO> toSelectionDTOs(List<Selection> selections);

    StandingEntryDTO toDTO(StandingEntry entry);

    List<StandingEntryDTO> toStandingDTOs(List<StandingEntry> entries);
}
