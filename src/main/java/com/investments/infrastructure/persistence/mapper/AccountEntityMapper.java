package com.investments.infrastructure.persistence.mapper;

import com.investments.domain.model.Account;
import com.investments.domain.model.Holding;
import com.investments.infrastructure.persistence.entity.AccountEntity;
import com.investments.infrastructure.persistence.entity.InvestmentEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Mapper(componentModel = "cdi")
public interface AccountEntityMapper {

    @Mapping(target = "holdings", source = "investments")
    Account toDomain(AccountEntity entity);

    @Mapping(target = "accountId", source = "account.id")
    @Mapping(target = "purchaseValue", source = "value")
    @Mapping(target = "purchaseDate", source = "date")
    Holding toHolding(InvestmentEntity entity);

    default LocalDate map(LocalDateTime localDateTime) {
        return localDateTime != null ? localDateTime.toLocalDate() : null;
    }
}
