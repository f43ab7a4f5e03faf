package org.subtrack.subscription;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.subtrack.global.exceptions.NotFoundException;
import org.subtrack.global.exceptions.StorageException;
import org.subtrack.global.exceptions.SubtrackException;
import org.subtrack.global.exceptions.ValidationUtils;
import org.subtrack.global.rest.RequestIds;
import org.subtrack.subscription.dto.Subscription;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

	private final SubscriptionStore store;
	private final SubscriptionProperties properties;
	private final Clock clock;
	
	public Mono<Subscription> create(Subscription dto) {
		return Mono.defer(() -> {
			validate(dto);
			Subscription toCreate = new Subscription(
				null,
				dto.getServiceName(),
				dto.getServicePrice(),
				dto.getUserId(),
				LocalDateTime.now(clock),
				dto.getEndedAt()
			);
			return guard(store.create(toCreate), "create", "user " + dto.getUserId());
		});
	}
	
	public Mono<Void> update(UUID id, Subscription dto) {
		return Mono.defer(() -> {
			ValidationUtils.field("id", id).notNull();
			validate(dto);
			Subscription toUpdate = dto.toBuilder().id(id).build();
			return guard(store.update(toUpdate), "update", "subscription " + id + " of user " + dto.getUserId())
			.doOnNext(updated -> {
				if (updated.longValue() == 0) log.debug("No subscription {} owned by {} to update", id, dto.getUserId());
			})
			.then();
		});
	}
	
	public Mono<Void> delete(UUID id, UUID userId) {
		return Mono.defer(() -> {
			ValidationUtils.field("id", id).notNull();
			ValidationUtils.field("userId", userId).notNull();
			return guard(store.delete(id, userId), "delete", "subscription " + id + " of user " + userId)
			.doOnNext(deleted -> {
				if (deleted.longValue() == 0) log.debug("No subscription {} owned by {} to delete", id, userId);
			})
			.then();
		});
	}
	
	public Flux<Subscription> list(UUID userId) {
		if (userId == null) return guard(store.listAll(), "listAll", "all users");
		return guard(store.listByUser(userId), "listByUser", "user " + userId);
	}
	
	public Mono<Subscription> get(UUID id) {
		return Mono.defer(() -> {
			ValidationUtils.field("id", id).notNull();
			return guard(store.getById(id), "getById", "subscription " + id)
			.switchIfEmpty(Mono.error(() -> new NotFoundException("subscription", id.toString())));
		});
	}
	
	public Mono<Long> totalCost(UUID userId, String serviceName, String from, String to) {
		return Mono.defer(() -> {
			ValidationUtils.field("userId", userId).notNull();
			ValidationUtils.field("serviceName", serviceName).notBlank();
			BillingPeriod period = BillingPeriod.of(from, to);
			return guard(
				store.aggregateCost(userId, serviceName, period.getStart(), period.getEnd()),
				"aggregateCost",
				"user " + userId + " and service " + serviceName
			)
			.doOnEach(signal -> {
				if (signal.isOnNext())
					log.info("[{}] Total cost of {} for user {} from {} to {}: {}", RequestIds.from(signal.getContextView()), serviceName, userId, from, to, signal.get());
			});
		});
	}
	
	private void validate(Subscription dto) {
		ValidationUtils.field("subscription", dto).notNull();
		ValidationUtils.field("serviceName", dto.getServiceName()).notNull();
		ValidationUtils.field("servicePrice", dto.getServicePrice()).notNull().notNegative();
		ValidationUtils.field("userId", dto.getUserId()).notNull();
	}
	
	private <T> Mono<T> guard(Mono<T> call, String operation, String target) {
		return call
		.timeout(properties.getStoreTimeout())
		.onErrorMap(e -> !(e instanceof SubtrackException), e -> new StorageException(operation, e))
		.doOnEach(signal -> logStorageError(signal, operation, target));
	}
	
	private <T> Flux<T> guard(Flux<T> call, String operation, String target) {
		return call
		.timeout(properties.getStoreTimeout())
		.onErrorMap(e -> !(e instanceof SubtrackException), e -> new StorageException(operation, e))
		.doOnEach(signal -> logStorageError(signal, operation, target));
	}
	
	private static void logStorageError(Signal<?> signal, String operation, String target) {
		if (signal.isOnError() && signal.getThrowable() instanceof StorageException e)
			log.error("[{}] Store operation {} failed for {}", RequestIds.from(signal.getContextView()), operation, target, e.getCause());
	}
	
}
