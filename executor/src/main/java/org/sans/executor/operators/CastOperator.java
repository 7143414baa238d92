package org.sans.executor.operators;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.executor.Values;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Explicit per-column conversion.  Dates and date-times are read in ISO form
 * and written back as ISO strings.  A value that cannot be converted either
 * fails the step or becomes missing, as each cast requests.
 */
public class CastOperator extends BaseOperator<CastStep> {
    static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    int failures;
    int nulled;

    public CastOperator(CastStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    /** Thrown by a single conversion; carries the reason. */
    static final class CastFailure extends Exception {
        CastFailure(String reason) {
            super(reason);
        }
    }

    static TemporalAccessor parseTemporal(String text) throws CastFailure {
        String normalized = text.replace("Z", "+00:00");
        if (normalized.length() > 10 && normalized.charAt(10) == ' ')
            normalized = normalized.substring(0, 10) + "T" + normalized.substring(11);
        try {
            if (normalized.length() == 10)
                return LocalDate.parse(normalized).atStartOfDay();
            try {
                return OffsetDateTime.parse(normalized);
            } catch (DateTimeParseException e) {
                return LocalDateTime.parse(normalized);
            }
        } catch (DateTimeParseException e) {
            throw new CastFailure("not an ISO date: '" + text + "'");
        }
    }

    static String isoDateTime(TemporalAccessor value) {
        LocalDateTime local = value instanceof OffsetDateTime ?
                ((OffsetDateTime) value).toLocalDateTime() : (LocalDateTime) value;
        StringBuilder result = new StringBuilder(SECONDS.format(local));
        int micros = local.get(ChronoField.MICRO_OF_SECOND);
        if (micros != 0)
            result.append(String.format(".%06d", micros));
        if (value instanceof OffsetDateTime)
            result.append(((OffsetDateTime) value).getOffset().getId().replace("Z", "+00:00"));
        return result.toString();
    }

    @Nullable
    static Object convert(Object value, CastStep.CastSpec cast) throws CastFailure {
        String text = Values.keyText(value);
        if (cast.trim)
            text = text.strip();
        switch (cast.target) {
            case STR:
                return text;
            case INT: {
                String digits = text.strip();
                if (digits.isEmpty())
                    throw new CastFailure("empty");
                try {
                    return Long.parseLong(digits.startsWith("+") ? digits.substring(1) : digits);
                } catch (NumberFormatException e) {
                    throw new CastFailure("not an int: '" + digits + "'");
                }
            }
            case DECIMAL: {
                String digits = text.strip();
                if (digits.isEmpty())
                    throw new CastFailure("empty");
                try {
                    return new BigDecimal(digits);
                } catch (NumberFormatException e) {
                    throw new CastFailure("not a decimal: '" + digits + "'");
                }
            }
            case BOOL: {
                String lower = text.toLowerCase();
                switch (lower) {
                    case "true": case "1": case "yes":
                        return true;
                    case "false": case "0": case "no":
                        return false;
                    case "":
                        throw new CastFailure("empty");
                    default:
                        throw new CastFailure("not a bool: '" + text + "'");
                }
            }
            case DATE: {
                String date = text.strip();
                if (date.isEmpty())
                    throw new CastFailure("empty");
                return LocalDate.from(parseTemporal(date)).toString();
            }
            case DATETIME: {
                String dateTime = text.strip();
                if (dateTime.isEmpty())
                    throw new CastFailure("empty");
                return isoDateTime(parseTemporal(dateTime));
            }
            default:
                throw new IllegalStateException("Unexpected cast target " + cast.target);
        }
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Schema schema = required(output);
        Table input = inputs.get(0);
        List<Row> result = new ArrayList<>(input.size());
        for (Row row: input.getRows()) {
            Map<String, Object> values = input.asMap(row);
            for (CastStep.CastSpec cast: this.step.casts) {
                Object value = values.get(cast.column);
                if (value == null)
                    continue;
                try {
                    values.put(cast.column, convert(value, cast));
                } catch (CastFailure failure) {
                    if (cast.onError == CastStep.OnError.FAIL)
                        throw new ExecutionError(ErrorCode.RUNTIME_CAST_FAILED,
                                "Cast of " + cast.column + " to " + cast.target.text + " failed: " +
                                        failure.getMessage());
                    this.failures++;
                    this.nulled++;
                    values.put(cast.column, null);
                }
            }
            result.add(Table.makeRow(schema, values));
        }
        this.counters.put("cast_failures", this.failures);
        this.counters.put("nulled", this.nulled);
        if (this.nulled > 0)
            this.warnings.add(this.nulled + " values could not be cast and were set to missing");
        return new Table(schema, result);
    }
}
