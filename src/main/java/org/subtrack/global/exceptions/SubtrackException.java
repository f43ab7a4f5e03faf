package org.subtrack.global.exceptions;

import org.springframework.http.HttpStatus;
import org.subtrack.global.rest.ApiError;

import lombok.Getter;

@Getter
public abstract class SubtrackException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	private final HttpStatus status;
	private final String errorCode;
	
	protected SubtrackException(HttpStatus status, String errorCode, String message) {
		super(message);
		this.status = status;
		this.errorCode = errorCode;
	}
	
	protected SubtrackException(HttpStatus status, String errorCode, String message, Throwable cause) {
		super(message, cause);
		this.status = status;
		this.errorCode = errorCode;
	}
	
	public ApiError toApiError() {
		return new ApiError(status.value(), errorCode, getMessage());
	}
	
}
