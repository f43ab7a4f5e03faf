package org.subtrack.subscription.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TotalCost {

	@Schema(requiredMode = Schema.RequiredMode.REQUIRED, description = "sum of the prices in minor currency units")
	private long totalCost;
	
}
