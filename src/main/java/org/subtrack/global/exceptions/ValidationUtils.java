package org.subtrack.global.exceptions;

import java.util.regex.Pattern;

import org.springframework.util.function.ThrowingConsumer;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ValidationUtils {
	
	public static final String INVALID_PREFIX = "invalid-";
	public static final String MISSING_PREFIX = "missing-";
	
	@SuppressWarnings("java:S1452")
	public static <T> Field<T, ?> field(String name, T value) {
		return new Field<>(name, value);
	}
	
	public static FieldString field(String name, String value) {
		return new FieldString(name, value);
	}
	
	public static FieldInteger field(String name, Integer value) {
		return new FieldInteger(name, value);
	}
	
	@RequiredArgsConstructor
	@SuppressWarnings("unchecked")
	public static class Field<T, S extends Field<T, S>> {
		
		protected final String name;
		protected final T value;
		
		public S notNull() {
			if (value == null) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be null");
			return (S) this;
		}
		
		public S valid(ThrowingConsumer<T> validation) {
			try {
				validation.accept(value);
			} catch (Exception e) {
				throw new BadRequestException(INVALID_PREFIX + name, "Invalid " + name + " (" + e.getMessage() + ")");
			}
			return (S) this;
		}
		
	}
	
	public static class FieldString extends Field<String, FieldString> {
		
		public FieldString(String name, String value) {
			super(name, value);
		}
		
		public FieldString notBlank() {
			if (value == null || value.isBlank()) throw new BadRequestException(MISSING_PREFIX + name, name + " cannot be empty");
			return this;
		}
		
		public FieldString matches(Pattern pattern, String expected) {
			if (!pattern.matcher(value).matches()) throw new BadRequestException(INVALID_PREFIX + name, "Invalid " + name + ": " + value + " does not match " + expected);
			return this;
		}
		
	}
	
	public static class FieldInteger extends Field<Integer, FieldInteger> {
		
		public FieldInteger(String name, Integer value) {
			super(name, value);
		}
		
		public FieldInteger notNegative() {
			if (value.intValue() < 0) throw new BadRequestException(INVALID_PREFIX + name, name + " cannot be negative");
			return this;
		}
		
	}
}
