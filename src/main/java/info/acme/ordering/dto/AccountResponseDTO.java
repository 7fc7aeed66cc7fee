package info.acme.ordering.dto;

import java.time.LocalDateTime;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "accounts", itemRelation = "account")
@Schema(description = "A registered customer account")
public class AccountResponseDTO extends RepresentationModel<AccountResponseDTO> {
    @Schema(description = "Unique identifier of the account", example = "1")
    private Long id;

    @Schema(description = "Name of the account holder", example = "Alice Johnson")
    private String name;

    @Schema(description = "Email of the account holder", example = "alice@example.com")
    private String email;

    @Schema(description = "Timestamp when the account was created", example = "2025-01-15T00:00:00")
    private LocalDateTime signupDate;
}
