package org.subtrack.subscription.db;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.subtrack.subscription.BillingPeriod;
import org.subtrack.subscription.SubscriptionStore;
import org.subtrack.subscription.dto.Subscription;
import org.subtrack.test.AbstractTest;
import org.testcontainers.junit.jupiter.Testcontainers;

import reactor.test.StepVerifier;

@Testcontainers(disabledWithoutDocker = true)
class TestR2dbcSubscriptionStore extends AbstractTest {

	@Autowired
	private SubscriptionStore store;
	
	private Subscription insert(String serviceName, int price, UUID userId, LocalDateTime startedAt) {
		return store.create(new Subscription(null, serviceName, price, userId, startedAt, null)).block();
	}
	
	@Test
	void testCreateAssignsId() {
		var user = UUID.randomUUID();
		var created = insert("Spotify", 300, user, LocalDateTime.of(2025, 1, 10, 12, 0));
		assertThat(created.getId()).isNotNull();
		StepVerifier.create(store.getById(created.getId()))
		.assertNext(row -> {
			assertThat(row.getServiceName()).isEqualTo("Spotify");
			assertThat(row.getServicePrice()).isEqualTo(300);
			assertThat(row.getUserId()).isEqualTo(user);
			assertThat(row.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 1, 10, 12, 0));
			assertThat(row.getEndedAt()).isNull();
		})
		.verifyComplete();
		StepVerifier.create(store.getById(UUID.randomUUID())).verifyComplete();
	}
	
	@Test
	void testAggregateBoundaries() {
		var user = UUID.randomUUID();
		insert("Yandex Plus", 1, user, LocalDateTime.of(2024, 12, 31, 23, 59, 59));
		insert("Yandex Plus", 10, user, LocalDateTime.of(2025, 1, 1, 0, 0, 0));
		insert("Yandex Plus", 100, user, LocalDateTime.of(2025, 3, 31, 23, 59, 59));
		insert("Yandex Plus", 1000, user, LocalDateTime.of(2025, 4, 1, 0, 0, 0));
		insert("Kinopoisk", 10000, user, LocalDateTime.of(2025, 2, 1, 0, 0, 0));
		insert("Yandex Plus", 100000, UUID.randomUUID(), LocalDateTime.of(2025, 2, 1, 0, 0, 0));
		
		var period = BillingPeriod.of("01-2025", "03-2025");
		StepVerifier.create(store.aggregateCost(user, "Yandex Plus", period.getStart(), period.getEnd()))
		.expectNext(110L)
		.verifyComplete();
		
		period = BillingPeriod.of("06-2025", "06-2025");
		StepVerifier.create(store.aggregateCost(user, "Yandex Plus", period.getStart(), period.getEnd()))
		.expectNext(0L)
		.verifyComplete();
		
		period = BillingPeriod.of("03-2025", "01-2025");
		StepVerifier.create(store.aggregateCost(user, "Yandex Plus", period.getStart(), period.getEnd()))
		.expectNext(0L)
		.verifyComplete();
	}
	
	@Test
	void testUpdateAndDeleteAreScopedByOwner() {
		var user = UUID.randomUUID();
		var created = insert("Netflix", 500, user, LocalDateTime.of(2025, 5, 5, 5, 5));
		var endedAt = LocalDateTime.of(2025, 12, 31, 0, 0);
		
		StepVerifier.create(store.update(new Subscription(created.getId(), "Netflix", 700, UUID.randomUUID(), null, endedAt)))
		.expectNext(0L)
		.verifyComplete();
		StepVerifier.create(store.update(new Subscription(created.getId(), "Netflix 4K", 700, user, null, endedAt)))
		.expectNext(1L)
		.verifyComplete();
		StepVerifier.create(store.getById(created.getId()))
		.assertNext(row -> {
			assertThat(row.getServiceName()).isEqualTo("Netflix 4K");
			assertThat(row.getServicePrice()).isEqualTo(700);
			assertThat(row.getEndedAt()).isEqualTo(endedAt);
			assertThat(row.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 5, 5, 5, 5));
		})
		.verifyComplete();
		StepVerifier.create(store.update(new Subscription(created.getId(), "Netflix 4K", 700, user, null, null)))
		.expectNext(1L)
		.verifyComplete();
		StepVerifier.create(store.getById(created.getId()).map(row -> row.getEndedAt() == null))
		.expectNext(true)
		.verifyComplete();
		
		StepVerifier.create(store.delete(created.getId(), UUID.randomUUID())).expectNext(0L).verifyComplete();
		StepVerifier.create(store.listByUser(user).count()).expectNext(1L).verifyComplete();
		StepVerifier.create(store.delete(created.getId(), user)).expectNext(1L).verifyComplete();
		StepVerifier.create(store.listByUser(user).count()).expectNext(0L).verifyComplete();
	}
	
}
