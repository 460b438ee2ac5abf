package com.namingtool.service.naming;

import com.namingtool.model.type.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a composed name against the naming rules of its resource type.
 *
 * <p>Rules run in a fixed order: character rules, length limits, then the type's
 * regular expression. The delimiter may be stripped to satisfy the length or regex
 * rules; the returned name reflects that.
 */
@Slf4j
@Service
public class NameValidatorService {

    public static final String LOWERCASE_MESSAGE =
        "This resource type only allows lowercase names. The generated name has been updated to lowercase characters.";
    public static final String REGEX_FAILED_MESSAGE =
        "Regex failed - Please review the Resource Type Naming Guidelines.";
    public static final String REGEX_DELIMITER_REMOVED_MESSAGE =
        "The specified delimiter was removed. This is often caused by the length of the name exceeding the max length "
            + "and the delimiter removed to shorten the value or the delimiter is not an allowed character for the resource type.";
    public static final String MIN_LENGTH_MESSAGE =
        "Generated name is less than the minimum length for the selected resource type.";
    public static final String MAX_LENGTH_MESSAGE =
        "Generated name is more than the maximum length for the selected resource type. "
            + "Please remove any optional components or contact your admin to update the required components for this resource type.";
    public static final String MAX_LENGTH_DELIMITER_REMOVED_MESSAGE =
        "Generated name with the selected delimiter is more than the maximum length for the selected resource type. "
            + "The delimiter has been removed.";
    public static final String VALIDATION_PROBLEM_MESSAGE = "There was a problem validating the name.";

    /**
     * Outcome of validating a name. {@code name} is the possibly normalized name and
     * supersedes the composed one when non-empty.
     */
    public record ValidationOutcome(boolean valid, String name, String message) {
    }

    public ValidationOutcome validate(ResourceType resourceType, String name, String delimiter) {
        String regex = resourceType.getRegex();
        String activeDelimiter = delimiter == null ? "" : delimiter;
        List<String> messages = new ArrayList<>();
        boolean valid = true;

        Pattern pattern = null;
        if (regex != null && !regex.isEmpty()) {
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid naming regex configured for resource type {}: {}",
                    resourceType.getShortName(), e.getMessage());
                return new ValidationOutcome(false, name, VALIDATION_PROBLEM_MESSAGE);
            }
            if (!regex.contains("A-Z") && !name.equals(name.toLowerCase(Locale.ROOT))) {
                messages.add(LOWERCASE_MESSAGE);
                name = name.toLowerCase(Locale.ROOT);
            }
        }

        // Character rules
        for (char c : chars(resourceType.getInvalidCharacters())) {
            if (name.indexOf(c) >= 0) {
                messages.add("Name cannot contain the following character: " + c);
                valid = false;
            }
        }
        for (char c : chars(resourceType.getInvalidCharactersStart())) {
            if (!name.isEmpty() && name.charAt(0) == c) {
                messages.add("Name cannot start with the following character: " + c);
                valid = false;
            }
        }
        for (char c : chars(resourceType.getInvalidCharactersEnd())) {
            if (!name.isEmpty() && name.charAt(name.length() - 1) == c) {
                messages.add("Name cannot end with the following character: " + c);
                valid = false;
            }
        }
        for (char c : chars(resourceType.getInvalidCharactersConsecutive())) {
            if (hasConsecutive(name, c)) {
                messages.add("Name cannot contain the following consecutive character: " + c);
                valid = false;
            }
        }

        // Length
        Integer lengthMin = resourceType.getLengthMin();
        Integer lengthMax = resourceType.getLengthMax();
        if (lengthMin != null && name.length() < lengthMin) {
            messages.add(MIN_LENGTH_MESSAGE);
            valid = false;
        }
        if (lengthMax != null && name.length() > lengthMax) {
            // character rules already ran on the delimited name
            String stripped = activeDelimiter.isEmpty() ? name : name.replace(activeDelimiter, "");
            if (stripped.length() > lengthMax) {
                messages.add(MAX_LENGTH_MESSAGE);
                valid = false;
            } else {
                messages.add(MAX_LENGTH_DELIMITER_REMOVED_MESSAGE);
                name = stripped;
            }
        }

        // Regex
        if (pattern != null && !pattern.matcher(name).find()) {
            if (!activeDelimiter.isEmpty() && name.contains(activeDelimiter)) {
                // stripped retry is not re-checked against the character rules
                String stripped = name.replace(activeDelimiter, "");
                if (pattern.matcher(stripped).find()) {
                    messages.add(REGEX_DELIMITER_REMOVED_MESSAGE);
                    name = stripped;
                } else {
                    messages.add(REGEX_FAILED_MESSAGE);
                    valid = false;
                }
            } else {
                messages.add(REGEX_FAILED_MESSAGE);
                valid = false;
            }
        }

        return new ValidationOutcome(valid, name, String.join(" ", messages));
    }

    private static char[] chars(String value) {
        return value == null ? new char[0] : value.toCharArray();
    }

    private static boolean hasConsecutive(String name, char c) {
        for (int i = 1; i < name.length(); i++) {
            if (name.charAt(i) == c && name.charAt(i - 1) == c) {
                return true;
            }
        }
        return false;
    }
}
