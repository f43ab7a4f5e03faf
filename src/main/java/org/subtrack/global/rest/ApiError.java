package org.subtrack.global.rest;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Schema(name = "Error")
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

	@Schema(description = "HTTP status code", example = "400")
	private int httpCode;
	@Schema(description = "machine readable code, like missing-userId or subscription-not-found")
	private String errorCode;
	@Schema(description = "human readable message")
	private String errorMessage;
	
}
