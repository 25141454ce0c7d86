package com.vidnyan.tfguard.adapter.out.patch;

import com.vidnyan.tfguard.application.port.out.ConfigParser;
import com.vidnyan.tfguard.application.port.out.PatchStrategy;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Patches by exact substring: the first occurrence of {@code before} is
 * replaced, an empty {@code before} appends after a blank line.
 */
@Component
@RequiredArgsConstructor
public class SubstringPatchStrategy implements PatchStrategy {

    static final String APPEND_SEPARATOR = "\n\n";

    private final ConfigParser configParser;

    @Override
    public String apply(String content, FixDiff diff) {
        if (diff.isAppend()) {
            return content + APPEND_SEPARATOR + diff.after();
        }
        int at = content.indexOf(diff.before());
        if (at < 0) {
            return content;
        }
        return content.substring(0, at) + diff.after() + content.substring(at + diff.before().length());
    }

    @Override
    public FixValidation validate(String content, FixDiff diff) {
        if (!diff.isAppend() && !content.contains(diff.before())) {
            return FixValidation.invalid("Before content not found in template");
        }
        String result = apply(content, diff);
        try {
            int originalCount = configParser.parse(content).resources().size();
            int patchedCount = configParser.parse(result).resources().size();
            if (patchedCount < originalCount) {
                return new FixValidation(false, "Fix removed resources from the template", result);
            }
        } catch (RuntimeException e) {
            return FixValidation.invalid("Parse error: " + e.getMessage());
        }
        return FixValidation.valid(result);
    }
}
