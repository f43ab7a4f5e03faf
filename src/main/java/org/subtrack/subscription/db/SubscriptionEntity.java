package org.subtrack.subscription.db;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;
import org.springframework.data.relational.core.sql.Column;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Table("subscriptions")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

	@Id
	private UUID id;
	
	private String serviceName;
	@org.springframework.data.relational.core.mapping.Column("sub_price")
	private int servicePrice;
	private UUID userId;
	private LocalDateTime startedAt;
	private LocalDateTime endedAt;
	
	public static final org.springframework.data.relational.core.sql.Table TABLE = org.springframework.data.relational.core.sql.Table.create("subscriptions");
	public static final Column COL_ID = Column.create("id", TABLE);
	public static final Column COL_SERVICE_NAME = Column.create("service_name", TABLE);
	public static final Column COL_SUB_PRICE = Column.create("sub_price", TABLE);
	public static final Column COL_USER_ID = Column.create("user_id", TABLE);
	public static final Column COL_STARTED_AT = Column.create("started_at", TABLE);
	public static final Column COL_ENDED_AT = Column.create("ended_at", TABLE);
	
}
