package com.vidnyan.tfguard.adapter.out.patch;

import com.vidnyan.tfguard.adapter.out.parser.HclConfigParser;
import com.vidnyan.tfguard.domain.remediation.FixDiff;
import com.vidnyan.tfguard.domain.remediation.FixValidation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubstringPatchStrategyTest {

    private static final String CONTENT = """
            resource "aws_ebs_volume" "a" {
              type = "gp2"
            }

            resource "aws_ebs_volume" "b" {
              type = "gp2"
            }""";

    private final SubstringPatchStrategy strategy = new SubstringPatchStrategy(new HclConfigParser());

    @Test
    void apply_ShouldReplaceOnlyFirstOccurrence() {
        String patched = strategy.apply(CONTENT, new FixDiff("type = \"gp2\"", "type = \"gp3\""));

        assertEquals(1, patched.split("gp3", -1).length - 1);
        assertTrue(patched.indexOf("gp3") < patched.indexOf("gp2"));
    }

    @Test
    void apply_ShouldAppendAfterBlankLine() {
        String patched = strategy.apply("a", FixDiff.append("b"));

        assertEquals("a\n\nb", patched);
    }

    @Test
    void apply_ShouldLeaveContentWhenBeforeIsMissing() {
        assertEquals(CONTENT, strategy.apply(CONTENT, new FixDiff("io2", "gp3")));
    }

    @Test
    void validate_ShouldReturnPatchedContent() {
        FixValidation validation = strategy.validate(CONTENT, new FixDiff("type = \"gp2\"", "type = \"gp3\""));

        assertTrue(validation.valid());
        assertNull(validation.error());
        assertTrue(validation.resultContent().contains("gp3"));
    }

    @Test
    void validate_ShouldRejectStaleBefore() {
        FixValidation validation = strategy.validate(CONTENT, new FixDiff("encrypted = false", "encrypted = true"));

        assertFalse(validation.valid());
        assertEquals("Before content not found in template", validation.error());
        assertNull(validation.resultContent());
    }

    @Test
    void validate_ShouldRejectFixThatDropsResources() {
        String second = CONTENT.substring(CONTENT.indexOf("resource \"aws_ebs_volume\" \"b\""));

        FixValidation validation = strategy.validate(CONTENT, new FixDiff(second, "# removed"));

        assertFalse(validation.valid());
        assertEquals("Fix removed resources from the template", validation.error());
        assertNotNull(validation.resultContent());
    }

    @Test
    void validate_ShouldAcceptAppendedResource() {
        FixValidation validation = strategy.validate(CONTENT, FixDiff.append("""
                resource "aws_s3_bucket" "c" {
                  bucket = "c"
                }"""));

        assertTrue(validation.valid());
    }
}
