package com.spreadbook.mapper;

import com.spreadbook.domain.model.Position;
import com.spreadbook.domain.model.PositionLeg;
import com.spreadbook.entity.PositionEntity;
import com.spreadbook.entity.PositionLegEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Position domain model and the positions / position_legs tables.
 *
 * <p>Legs are mapped separately because they live in their own table; the store stitches them
 * onto the position. A leg's row id travels as {@code sourceRowRef} so that a rewritten leg keeps
 * its id. Audit timestamps are owned by the store and ignored here.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    PositionEntity toEntity(Position position);

    @Mapping(target = "legs", ignore = true)
    Position toDomain(PositionEntity entity);

    @Mapping(source = "id", target = "sourceRowRef")
    PositionLeg toDomainLeg(PositionLegEntity entity);

    List<PositionLeg> toDomainLegs(List<PositionLegEntity> entities);

    @Mapping(source = "sourceRowRef", target = "id")
    @Mapping(target = "canonicalKey", ignore = true)
    @Mapping(target = "legOrder", ignore = true)
    PositionLegEntity toLegEntity(PositionLeg leg);
}
