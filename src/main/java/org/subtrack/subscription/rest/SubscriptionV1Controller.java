package org.subtrack.subscription.rest;

import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.subtrack.global.rest.ApiError;
import org.subtrack.subscription.SubscriptionService;
import org.subtrack.subscription.dto.Subscription;
import org.subtrack.subscription.dto.TotalCost;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
@Tag(name = "subscriptions")
public class SubscriptionV1Controller {

	private final SubscriptionService service;
	
	@Operation(summary = "Create a subscription", description = "The id and the start date are assigned by the server.")
	@ApiResponses({
		@ApiResponse(responseCode = "201", description = "subscription created"),
		@ApiResponse(responseCode = "400", description = "request is not valid", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@PostMapping
	@ResponseStatus(HttpStatus.CREATED)
	public Mono<Subscription> create(@RequestBody Subscription subscription) {
		return service.create(subscription);
	}
	
	@Operation(summary = "List subscriptions", description = "All subscriptions, or only the ones of the given user.")
	@ApiResponses({
		@ApiResponse(responseCode = "200", description = "list of subscriptions"),
		@ApiResponse(responseCode = "400", description = "user_id is not a valid UUID", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@GetMapping
	public Flux<Subscription> list(
		@Parameter(description = "owner to filter on") @RequestParam(name = "user_id", required = false) UUID userId
	) {
		return service.list(userId);
	}
	
	@Operation(summary = "Total cost of a service for a user", description = "Sum of the prices of the subscriptions started between the first day of from and the last day of to.")
	@ApiResponses({
		@ApiResponse(responseCode = "200", description = "total cost, 0 when nothing matches"),
		@ApiResponse(responseCode = "400", description = "a parameter is missing or malformed", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@GetMapping("/total")
	public Mono<TotalCost> totalCost(
		@Parameter(description = "owner of the subscriptions", required = true) @RequestParam(name = "user_id", required = false) UUID userId,
		@Parameter(description = "exact service name", required = true) @RequestParam(name = "service_name", required = false) String serviceName,
		@Parameter(description = "first month, MM-YYYY", required = true, example = "01-2025") @RequestParam(name = "from", required = false) String from,
		@Parameter(description = "last month, MM-YYYY", required = true, example = "03-2025") @RequestParam(name = "to", required = false) String to
	) {
		return service.totalCost(userId, serviceName, from, to).map(TotalCost::new);
	}
	
	@Operation(summary = "Get a subscription")
	@ApiResponses({
		@ApiResponse(responseCode = "200", description = "the subscription"),
		@ApiResponse(responseCode = "400", description = "id is not a valid UUID", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "404", description = "no subscription with this id", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@GetMapping("/{id}")
	public Mono<Subscription> get(@PathVariable("id") UUID id) {
		return service.get(id);
	}
	
	@Operation(summary = "Update a subscription", description = "Changes service name, price and end date. Nothing changes when the subscription does not belong to user_id.")
	@ApiResponses({
		@ApiResponse(responseCode = "200", description = "update applied"),
		@ApiResponse(responseCode = "400", description = "request is not valid", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@PutMapping("/{id}")
	public Mono<Void> update(@PathVariable("id") UUID id, @RequestBody Subscription subscription) {
		return service.update(id, subscription);
	}
	
	@Operation(summary = "Delete a subscription", description = "Nothing is deleted when the subscription does not belong to user_id.")
	@ApiResponses({
		@ApiResponse(responseCode = "204", description = "deletion applied"),
		@ApiResponse(responseCode = "400", description = "request is not valid", content = @Content(schema = @Schema(implementation = ApiError.class))),
		@ApiResponse(responseCode = "500", description = "storage or internal error", content = @Content(schema = @Schema(implementation = ApiError.class))),
	})
	@DeleteMapping("/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> delete(
		@PathVariable("id") UUID id,
		@Parameter(description = "owner of the subscription", required = true) @RequestParam(name = "user_id", required = false) UUID userId
	) {
		return service.delete(id, userId);
	}
	
}
