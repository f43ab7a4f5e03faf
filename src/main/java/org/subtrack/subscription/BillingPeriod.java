package org.subtrack.subscription;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

import org.subtrack.global.exceptions.ValidationUtils;

import lombok.Value;

/**
 * Closed range of instants covering whole months, built from two {@code MM-YYYY} strings.
 * A start after the end is kept as is: such a range simply matches nothing.
 */
@Value
public class BillingPeriod {

	private static final Pattern MONTH_PATTERN = Pattern.compile("\\d{2}-\\d{4}");
	private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("MM-uuuu").withResolverStyle(ResolverStyle.STRICT);
	
	LocalDateTime start;
	LocalDateTime end;
	
	public static BillingPeriod of(String from, String to) {
		YearMonth fromMonth = parseMonth("from", from);
		YearMonth toMonth = parseMonth("to", to);
		return new BillingPeriod(
			fromMonth.atDay(1).atStartOfDay(),
			toMonth.plusMonths(1).atDay(1).atStartOfDay().minusSeconds(1)
		);
	}
	
	private static YearMonth parseMonth(String name, String value) {
		ValidationUtils.field(name, value).notBlank().matches(MONTH_PATTERN, "MM-YYYY").valid(v -> YearMonth.parse(v, MONTH_FORMAT));
		return YearMonth.parse(value, MONTH_FORMAT);
	}
	
}
