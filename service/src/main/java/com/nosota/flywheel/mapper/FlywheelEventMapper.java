package com.nosota.flywheel.mapper;

import com.nosota.flywheel.api.dto.FlywheelEventDTO;
import com.nosota.flywheel.model.FlywheelEvent;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for FlywheelEvent entity to FlywheelEventDTO conversion.
 */
@Mapper
public interface FlywheelEventMapper {

    FlywheelEventMapper INSTANCE = Mappers.getMapper(FlywheelEventMapper.class);

    FlywheelEventDTO toDTO(FlywheelEvent event);

    List<FlywheelEventDTO> toDTOList(List<FlywheelEvent> events);
}
