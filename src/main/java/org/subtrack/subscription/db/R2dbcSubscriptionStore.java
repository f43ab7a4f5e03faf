package org.subtrack.subscription.db;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.sql.Assignments;
import org.springframework.data.relational.core.sql.Condition;
import org.springframework.data.relational.core.sql.Conditions;
import org.springframework.data.relational.core.sql.Delete;
import org.springframework.data.relational.core.sql.Expression;
import org.springframework.data.relational.core.sql.SQL;
import org.springframework.data.relational.core.sql.Select;
import org.springframework.data.relational.core.sql.SimpleFunction;
import org.springframework.data.relational.core.sql.Update;
import org.springframework.r2dbc.core.binding.MutableBindings;
import org.springframework.stereotype.Component;
import org.subtrack.global.db.DbUtils;
import org.subtrack.subscription.SubscriptionStore;
import org.subtrack.subscription.dto.Subscription;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class R2dbcSubscriptionStore implements SubscriptionStore {

	private static final String TOTAL = "total";
	
	private final SubscriptionRepository repo;
	private final R2dbcEntityTemplate r2dbc;
	
	@Override
	public Mono<Subscription> create(Subscription subscription) {
		SubscriptionEntity entity = new SubscriptionEntity(
			null,
			subscription.getServiceName(),
			subscription.getServicePrice(),
			subscription.getUserId(),
			subscription.getStartedAt(),
			subscription.getEndedAt()
		);
		return r2dbc.insert(entity).map(this::toDto);
	}
	
	@Override
	public Mono<Long> update(Subscription subscription) {
		MutableBindings bindings = DbUtils.bindings(r2dbc);
		Expression endedAt = subscription.getEndedAt() == null ? SQL.nullLiteral() : DbUtils.bind(bindings, subscription.getEndedAt());
		var update = Update.builder()
		.table(SubscriptionEntity.TABLE)
		.set(
			Assignments.value(SubscriptionEntity.COL_SERVICE_NAME, DbUtils.bind(bindings, subscription.getServiceName())),
			Assignments.value(SubscriptionEntity.COL_SUB_PRICE, DbUtils.bind(bindings, subscription.getServicePrice())),
			Assignments.value(SubscriptionEntity.COL_ENDED_AT, endedAt)
		)
		.where(ownedBy(bindings, subscription.getId(), subscription.getUserId()))
		.build();
		return r2dbc.getDatabaseClient().sql(DbUtils.update(update, bindings, r2dbc)).fetch().rowsUpdated();
	}
	
	@Override
	public Mono<Long> delete(UUID id, UUID userId) {
		MutableBindings bindings = DbUtils.bindings(r2dbc);
		var delete = Delete.builder()
		.from(SubscriptionEntity.TABLE)
		.where(ownedBy(bindings, id, userId))
		.build();
		return r2dbc.getDatabaseClient().sql(DbUtils.delete(delete, bindings, r2dbc)).fetch().rowsUpdated();
	}
	
	@Override
	public Flux<Subscription> listAll() {
		return repo.findAll().map(this::toDto);
	}
	
	@Override
	public Flux<Subscription> listByUser(UUID userId) {
		return repo.findAllByUserId(userId).map(this::toDto);
	}
	
	@Override
	public Mono<Subscription> getById(UUID id) {
		return repo.findById(id).map(this::toDto);
	}
	
	@Override
	public Mono<Long> aggregateCost(UUID userId, String serviceName, LocalDateTime from, LocalDateTime to) {
		MutableBindings bindings = DbUtils.bindings(r2dbc);
		var select = Select.builder()
		.select(
			SimpleFunction.create("COALESCE", List.of(
				SimpleFunction.create("SUM", List.of(SubscriptionEntity.COL_SUB_PRICE)),
				SQL.literalOf(0)
			)).as(TOTAL)
		)
		.from(SubscriptionEntity.TABLE)
		.where(
			Conditions.isEqual(SubscriptionEntity.COL_USER_ID, DbUtils.bind(bindings, userId))
			.and(Conditions.isEqual(SubscriptionEntity.COL_SERVICE_NAME, DbUtils.bind(bindings, serviceName)))
			.and(Conditions.isGreaterOrEqualTo(SubscriptionEntity.COL_STARTED_AT, DbUtils.bind(bindings, from)))
			.and(Conditions.isLessOrEqualTo(SubscriptionEntity.COL_STARTED_AT, DbUtils.bind(bindings, to)))
		)
		.build();
		return r2dbc.getDatabaseClient().sql(DbUtils.select(select, bindings, r2dbc))
		.map((row, meta) -> row.get(TOTAL, Long.class))
		.one()
		.defaultIfEmpty(0L);
	}
	
	private static Condition ownedBy(MutableBindings bindings, UUID id, UUID userId) {
		return Conditions.isEqual(SubscriptionEntity.COL_ID, DbUtils.bind(bindings, id))
		.and(Conditions.isEqual(SubscriptionEntity.COL_USER_ID, DbUtils.bind(bindings, userId)));
	}
	
	private Subscription toDto(SubscriptionEntity entity) {
		return new Subscription(
			entity.getId(),
			entity.getServiceName(),
			entity.getServicePrice(),
			entity.getUserId(),
			entity.getStartedAt(),
			entity.getEndedAt()
		);
	}
	
}
