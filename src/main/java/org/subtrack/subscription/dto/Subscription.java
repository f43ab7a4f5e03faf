package org.subtrack.subscription.dto;

import java.time.LocalDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Subscription {

	@Schema(accessMode = Schema.AccessMode.READ_ONLY, description = "assigned by the server")
	private UUID id;
	
	@Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "name of the subscribed service", example = "Yandex Plus")
	private String serviceName;
	@Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "monthly price in minor currency units, not negative", example = "400")
	private Integer servicePrice;
	@Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "owner of the subscription")
	private UUID userId;
	@Schema(accessMode = Schema.AccessMode.READ_ONLY, description = "set by the server at creation")
	private LocalDateTime startedAt;
	/** {@code null} while the subscription is still active. */
	@Schema(description = "end of the subscription, absent while it is active")
	private LocalDateTime endedAt;
	
}
