package com.hoopstats.application.validation;

import com.hoopstats.domain.model.FieldViolation;
import com.hoopstats.domain.model.RawRecord;
import com.hoopstats.domain.model.RawValue;
import com.hoopstats.domain.model.Team;
import com.hoopstats.domain.model.ValidationOutcome;
import com.hoopstats.domain.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Checks raw records against the field rules and types the surviving values.
 *
 * <p>Policy:</p>
 * <ul>
 *   <li>blank player name, unresolvable team or a missing required field: rejected</li>
 *   <li>unparseable or out-of-range value: the field is dropped and the record is repaired</li>
 *   <li>more than {@code maxInvalidRequiredFraction} of the required fields invalid: rejected</li>
 * </ul>
 * Every repaired or rejected outcome is logged with the violated rules.
 */
public class RecordValidator {

    private static final Logger logger = LoggerFactory.getLogger(RecordValidator.class);

    public static final String RULE_REQUIRED = "required";
    public static final String RULE_NUMERIC = "type:numeric";
    public static final String RULE_INTEGER = "type:integer";
    public static final String RULE_DOMAIN = "domain";
    public static final String RULE_TOO_MANY_INVALID = "required-invalid-fraction";

    private final ValidationRules rules;

    public RecordValidator(ValidationRules rules) {
        this.rules = rules;
    }

    public ValidationOutcome validate(RawRecord record) {
        List<FieldViolation> violations = new ArrayList<>();

        // Identity first: without a name and a known team the record cannot be grouped
        String name = record.getEntityKey().name();
        if (name == null || name.isBlank()) {
            violations.add(new FieldViolation("player", RULE_REQUIRED, String.valueOf(name)));
        }
        Optional<Team> team = Team.resolve(record.getEntityKey().team());
        if (team.isEmpty()) {
            violations.add(new FieldViolation("team", RULE_DOMAIN, String.valueOf(record.getEntityKey().team())));
        }
        if (!violations.isEmpty()) {
            return reject(record, violations);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, Object> repaired = new HashMap<>();
        int invalidRequired = 0;
        boolean missingRequired = false;

        for (Map.Entry<String, FieldRule> entry : rules.getRules().entrySet()) {
            String field = entry.getKey();
            FieldRule rule = entry.getValue();
            RawValue raw = record.field(field);

            if (raw.isBlank()) {
                if (rule.required()) {
                    violations.add(new FieldViolation(field, RULE_REQUIRED, "absent"));
                    missingRequired = true;
                }
                continue;
            }

            FieldViolation violation = null;
            Object typed = null;
            switch (rule.type()) {
                case NUMERIC:
                case INTEGER: {
                    BigDecimal number = toNumber(raw);
                    if (number == null) {
                        violation = new FieldViolation(field, RULE_NUMERIC, raw.asText());
                    } else if (rule.type() == FieldType.INTEGER && !isIntegral(number)) {
                        violation = new FieldViolation(field, RULE_INTEGER, raw.asText());
                    } else if ((rule.min() != null && number.doubleValue() < rule.min())
                        || (rule.max() != null && number.doubleValue() > rule.max())) {
                        violation = new FieldViolation(field, rule.rangeLabel(), raw.asText());
                    } else if (rule.type() == FieldType.INTEGER) {
                        typed = number.intValue();
                    } else {
                        typed = number.doubleValue();
                    }
                    break;
                }
                case ENUM: {
                    String member = matchDomain(raw.asText(), rule.domain());
                    if (member == null) {
                        violation = new FieldViolation(field, RULE_DOMAIN, raw.asText());
                    } else {
                        typed = member;
                    }
                    break;
                }
                case STRING:
                default:
                    typed = raw.asText().trim();
                    break;
            }

            if (violation != null) {
                violations.add(violation);
                repaired.put(field, null);
                if (rule.required()) {
                    invalidRequired++;
                }
            } else {
                values.put(field, typed);
            }
        }

        if (missingRequired) {
            return reject(record, violations);
        }
        long requiredTotal = rules.requiredCount();
        if (requiredTotal > 0 && (double) invalidRequired / requiredTotal > rules.getMaxInvalidRequiredFraction()) {
            violations.add(new FieldViolation("*", RULE_TOO_MANY_INVALID, invalidRequired + "/" + requiredTotal));
            return reject(record, violations);
        }

        // Fields nobody declared a rule for pass through typed on a best-effort basis
        for (Map.Entry<String, RawValue> entry : record.getFields().entrySet()) {
            if (rules.rule(entry.getKey()) != null || entry.getValue().isBlank()) {
                continue;
            }
            RawValue raw = entry.getValue();
            if (raw.getKind() == RawValue.Kind.UNKNOWN) {
                continue;
            }
            BigDecimal number = toNumber(raw);
            values.put(entry.getKey(), number != null ? (Object) number.doubleValue() : raw.asText().trim());
        }

        if (violations.isEmpty()) {
            logger.debug("Accepted {} from {}", record.getEntityKey(), record.getSourceId());
            return new ValidationOutcome(record, ValidationStatus.ACCEPTED, violations, values, repaired, team.get());
        }
        logger.info("Repaired {} from {}: {}", record.getEntityKey(), record.getSourceId(), violations);
        return new ValidationOutcome(record, ValidationStatus.REPAIRED, violations, values, repaired, team.get());
    }

    private ValidationOutcome reject(RawRecord record, List<FieldViolation> violations) {
        logger.warn("Rejected {} from {}: {}", record.getEntityKey(), record.getSourceId(), violations);
        return ValidationOutcome.rejected(record, violations);
    }

    /**
     * Parses numbers the way sources print them: "1,234", ".497", "45.1%".
     */
    static BigDecimal toNumber(RawValue raw) {
        if (raw.getKind() == RawValue.Kind.NUMBER) {
            return raw.asNumber();
        }
        if (raw.getKind() != RawValue.Kind.STRING) {
            return null;
        }
        String text = raw.asText().trim().replace(",", "");
        boolean percent = text.endsWith("%");
        if (percent) {
            text = text.substring(0, text.length() - 1).trim();
        }
        try {
            BigDecimal number = new BigDecimal(text);
            return percent ? number.movePointLeft(2) : number;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isIntegral(BigDecimal number) {
        return number.signum() == 0 || number.stripTrailingZeros().scale() <= 0;
    }

    private static String matchDomain(String text, List<String> domain) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (domain.contains(value)) {
            return value;
        }
        // hybrid labels such as "SF-PF" count as their first component
        String first = value.split("[-/ ,]+")[0];
        return domain.contains(first) ? first : null;
    }
}
