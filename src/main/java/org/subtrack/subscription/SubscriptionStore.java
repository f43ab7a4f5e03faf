package org.subtrack.subscription;

import java.time.LocalDateTime;
import java.util.UUID;

import org.subtrack.subscription.dto.Subscription;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage of subscriptions. Each operation issues a single statement, cancelling the
 * returned publisher aborts it.
 */
public interface SubscriptionStore {

	/** Inserts the subscription and emits it with the id assigned by the store. */
	Mono<Subscription> create(Subscription subscription);
	
	/**
	 * Updates service name, price and end date of the row matching both id and user id.
	 * Emits the number of affected rows.
	 */
	Mono<Long> update(Subscription subscription);
	
	/** Deletes the row matching both id and user id, emits the number of affected rows. */
	Mono<Long> delete(UUID id, UUID userId);
	
	Flux<Subscription> listAll();
	
	Flux<Subscription> listByUser(UUID userId);
	
	/** Empty when no row has this id. */
	Mono<Subscription> getById(UUID id);
	
	/**
	 * Sum of the prices of the subscriptions of the user for the service, started within
	 * {@code [from, to]} (both inclusive). Emits 0 when nothing matches.
	 */
	Mono<Long> aggregateCost(UUID userId, String serviceName, LocalDateTime from, LocalDateTime to);
	
}
