package com.investments.infrastructure.persistence.mapper;

import com.investments.domain.model.ExchangeRate;
import com.investments.infrastructure.persistence.entity.ExchangeRateEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Mapper(componentModel = "cdi")
public interface ExchangeRateEntityMapper {

    ExchangeRate toDomain(ExchangeRateEntity entity);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    ExchangeRateEntity toEntity(ExchangeRate domain);

    default Instant map(OffsetDateTime offsetDateTime) {
        return offsetDateTime != null ? offsetDateTime.toInstant() : null;
    }

    default OffsetDateTime map(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }
}
