package com.catalogharvester.crawl.compat;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class YearExpanderTest {

    @Test
    void expandsInclusiveRange() {
        assertThat(YearExpander.expand("2009-2015"))
            .containsExactly("2009", "2010", "2011", "2012", "2013", "2014", "2015");
    }

    @Test
    void acceptsEnDashAndSpaces() {
        assertThat(YearExpander.expand("2015\u20132016")).containsExactly("2015", "2016");
        assertThat(YearExpander.expand("2019 \u2013 2020")).containsExactly("2019", "2020");
    }

    @Test
    void singleYearRangeGivesOneYear() {
        assertThat(YearExpander.expand("2015-2015")).containsExactly("2015");
    }

    @Test
    void reversedRangeGivesNothing() {
        assertThat(YearExpander.expand("2015-2009")).isEmpty();
    }

    @Test
    void leadingYearIsTakenFromLongerText() {
        assertThat(YearExpander.expand("2012 Model")).containsExactly("2012");
        assertThat(YearExpander.expand("2012 onwards")).containsExactly("2012");
    }

    @Test
    void otherTextIsKeptVerbatim() {
        assertThat(YearExpander.expand("  All years ")).containsExactly("All years");
    }

    @Test
    void blankGivesNothing() {
        assertThat(YearExpander.expand("")).isEmpty();
        assertThat(YearExpander.expand("   ")).isEmpty();
        assertThat(YearExpander.expand(null)).isEmpty();
    }
}
