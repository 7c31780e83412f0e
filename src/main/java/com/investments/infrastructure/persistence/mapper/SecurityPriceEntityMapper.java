package com.investments.infrastructure.persistence.mapper;

import com.investments.domain.model.SecurityPrice;
import com.investments.infrastructure.persistence.entity.SecurityPriceEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Mapper(componentModel = "cdi")
public interface SecurityPriceEntityMapper {

    SecurityPrice toDomain(SecurityPriceEntity entity);

    List<SecurityPrice> toDomain(List<SecurityPriceEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    SecurityPriceEntity toEntity(SecurityPrice domain);

    default Instant map(OffsetDateTime offsetDateTime) {
        return offsetDateTime != null ? offsetDateTime.toInstant() : null;
    }

    default OffsetDateTime map(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }
}
