package info.acme.ordering.mapper;

import org.mapstruct.Mapper;

import info.acme.ordering.domain.Account;
import info.acme.ordering.dto.AccountResponseDTO;

@Mapper(componentModel = "spring")
public interface AccountMapper {
    AccountResponseDTO toAccountResponseDto(Account entity);
}
