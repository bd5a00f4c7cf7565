package com.questrail.iso8583.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FieldSchemaTest
{
    @Test
    void exposesRulesInFieldOrder()
    {
        FieldSchema schema = TestSchemas.payments();

        assertEquals(4, schema.mtiRule().maxLen());
        assertEquals(16, schema.bitmapRule().maxLen());
        assertEquals(Integer.valueOf(0), schema.rules().firstKey());
        assertEquals(Integer.valueOf(70), schema.rules().lastKey());
        assertTrue(schema.rule(2).isPresent());
        assertFalse(schema.rule(5).isPresent());
    }

    @Test
    void rulesAreUnmodifiable()
    {
        FieldSchema schema = TestSchemas.payments();
        assertThrows(UnsupportedOperationException.class,
                () -> schema.rules().put(5, FieldRule.fixed("n", 12, "Amount, Settlement")));
    }

    @Test
    void emptySchemaIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> FieldSchema.builder().build());
    }

    @Test
    void mtiIsRequired()
    {
        FieldSchema.Builder builder = FieldSchema.builder()
                .field(1, FieldRule.fixed("b", 16, "Bitmap"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void bitmapIsRequired()
    {
        FieldSchema.Builder builder = FieldSchema.builder()
                .field(0, FieldRule.fixed("n", 4, "MTI"))
                .field(2, FieldRule.llvar("n", 19, "PAN"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("field 1"));
    }

    @Test
    void bitmapMustBeFixed()
    {
        FieldSchema.Builder builder = FieldSchema.builder()
                .field(0, FieldRule.fixed("n", 4, "MTI"))
                .field(1, FieldRule.llvar("b", 16, "Bitmap"));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void bitmapWidthMustBeEvenAndAtMostThirtyTwo()
    {
        assertThrows(IllegalArgumentException.class, () -> FieldSchema.builder()
                .field(0, FieldRule.fixed("n", 4, "MTI"))
                .field(1, FieldRule.fixed("b", 15, "Bitmap"))
                .build());
        assertThrows(IllegalArgumentException.class, () -> FieldSchema.builder()
                .field(0, FieldRule.fixed("n", 4, "MTI"))
                .field(1, FieldRule.fixed("b", 34, "Bitmap"))
                .build());
    }

    @Test
    void fieldNumbersOutsideRangeAreRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> FieldSchema.builder().field(129, FieldRule.fixed("n", 1, "")));
        assertThrows(IllegalArgumentException.class,
                () -> FieldSchema.builder().field(-1, FieldRule.fixed("n", 1, "")));
    }

    @Test
    void unknownLengthTypeIsAcceptedUntilUsed()
    {
        FieldRule rule = TestSchemas.payments().rule(7).orElseThrow();
        assertEquals("lvar", rule.lengthType());
        assertTrue(rule.resolvedLengthType().isEmpty());
    }

    @Test
    void numericContentTypeIsCaseInsensitive()
    {
        assertTrue(FieldRule.fixed("N", 6, "").isNumeric());
        assertFalse(FieldRule.fixed("an", 6, "").isNumeric());
    }

    @Test
    void negativeMaxLenIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new FieldRule("n", "x", "fixed", -1));
    }
}
