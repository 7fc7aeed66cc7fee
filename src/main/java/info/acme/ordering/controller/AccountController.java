package info.acme.ordering.controller;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;

import org.springframework.hateoas.Link;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.acme.ordering.domain.Account;
import info.acme.ordering.dto.AccountResponseDTO;
import info.acme.ordering.identity.CallerIdentity;
import info.acme.ordering.identity.CallerIdentityResolver;
import info.acme.ordering.mapper.AccountMapper;
import info.acme.ordering.service.AccountService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for the caller's own account. The account name and email
 * come from the {@code user-info} header.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@Tag(name = "Accounts API", description = "Endpoints for registering and retrieving the caller's account")
@Slf4j
public class AccountController {
    private final AccountService accountService;
    private final AccountMapper accountMapper;
    private final CallerIdentityResolver callerIdentityResolver;

    public AccountController(AccountService accountService, AccountMapper accountMapper,
            CallerIdentityResolver callerIdentityResolver) {
        this.accountService = accountService;
        this.accountMapper = accountMapper;
        this.callerIdentityResolver = callerIdentityResolver;
    }

    @PostMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Create My Account", description = "Registers an account for the caller's name and email.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Account created", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = AccountResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Caller identity lacks name or email", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Account with that email already exists", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<AccountResponseDTO> createAccount(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Account account = accountService.createAccount(caller.getName(), caller.getEmail());

        Link selfLink = linkTo(AccountController.class).slash("me").withSelfRel();
        AccountResponseDTO responseDTO = accountMapper.toAccountResponseDto(account);
        responseDTO.add(selfLink);

        return ResponseEntity.created(selfLink.toUri()).body(responseDTO);
    }

    @GetMapping(value = "/me", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get My Account", description = "Retrieves the account details of the caller.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Account retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = AccountResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "No account for the caller's email", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<AccountResponseDTO> findMyAccount(
            @Parameter(hidden = true) @RequestHeader(name = CallerIdentityResolver.USER_INFO_HEADER, required = false) String userInfo) {
        CallerIdentity caller = callerIdentityResolver.resolve(userInfo);
        Account account = accountService.findAccountByEmail(caller.getEmail());

        AccountResponseDTO responseDTO = accountMapper.toAccountResponseDto(account);
        responseDTO.add(linkTo(AccountController.class).slash("me").withSelfRel());

        return ResponseEntity.ok(responseDTO);
    }
}
