package com.example.walmartcrawling.extractor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriceParserTest {

    @Test
    void parsesCurrencyWithThousandsSeparator() {
        ParsedPrice price = PriceParser.parse("$1,234.50");

        assertThat(price.isNumeric()).isTrue();
        assertThat(price.getAmount()).isEqualTo(1234.50);
        assertThat(price.getRawText()).isNull();
    }

    @Test
    void trimsSurroundingWhitespace() {
        assertThat(PriceParser.parse("  $19.99 ").getAmount()).isEqualTo(19.99);
    }

    @Test
    void keepsUnparsableTextVerbatim() {
        ParsedPrice price = PriceParser.parse("  Contact for price ");

        assertThat(price.isNumeric()).isFalse();
        assertThat(price.getAmount()).isNull();
        assertThat(price.getRawText()).isEqualTo("Contact for price");
        assertThat(price.display()).isEqualTo("Contact for price");
    }

    @Test
    void notFoundDefaultsToZero() {
        assertThat(ParsedPrice.NOT_FOUND.getAmount()).isEqualTo(0.0);
        assertThat(ParsedPrice.NOT_FOUND.isNumeric()).isTrue();
    }
}
