package org.subtrack.global.exceptions;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Failure of the durable store: connectivity, constraint violation, timeout, cancelled
 * connection or exhausted pool. The message returned to clients stays generic, the cause is only
 * logged.
 */
@Getter
public class StorageException extends SubtrackException {

	private static final long serialVersionUID = 1L;
	
	private final String operation;

	public StorageException(String operation, Throwable cause) {
		super(HttpStatus.INTERNAL_SERVER_ERROR, "storage-error", "Storage failure", cause);
		this.operation = operation;
	}
	
}
