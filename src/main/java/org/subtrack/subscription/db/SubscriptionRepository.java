package org.subtrack.subscription.db;

import java.util.UUID;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;

import reactor.core.publisher.Flux;

public interface SubscriptionRepository extends ReactiveCrudRepository<SubscriptionEntity, UUID> {

	Flux<SubscriptionEntity> findAllByUserId(UUID userId);
	
}
