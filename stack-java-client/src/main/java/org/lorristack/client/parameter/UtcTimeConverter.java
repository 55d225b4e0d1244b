package org.lorristack.client.parameter;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Converts "yyyy-MM-dd HH:mm:ss" or "yyyy-MM-dd" (UTC) command line values to epoch seconds.
 * Date only values identify the start of that day.
 */
public class UtcTimeConverter
        implements IStringConverter<Long> {

    public static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public Long convert(final String value)
            throws ParameterException {

        final String trimmedValue = value == null ? "" : value.trim();
        try {
            if (trimmedValue.length() > 10) {
                return LocalDateTime.parse(trimmedValue, DATE_TIME_FORMATTER).toEpochSecond(ZoneOffset.UTC);
            } else {
                return LocalDate.parse(trimmedValue).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
            }
        } catch (final DateTimeParseException e) {
            throw new ParameterException("invalid time '" + value +
                                         "', must be formatted as 'yyyy-MM-dd HH:mm:ss' or 'yyyy-MM-dd'", e);
        }
    }
}
