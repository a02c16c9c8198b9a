package com.example.retrosheet.normalize;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DelimitedLineTest {

    @Test
    void delimitersInsideQuotesDoNotSplit() {
        assertThat(DelimitedLine.countFields("a,\"b,c\",d", ',', '"')).isEqualTo(3);
        assertThat(DelimitedLine.countFields("", ',', '"')).isEqualTo(1);
        assertThat(DelimitedLine.countFields("a,,", ',', '"')).isEqualTo(3);
    }

    @Test
    void doubledQuoteKeepsValueQuoted() {
        assertThat(DelimitedLine.hasOpenQuote("1,\"say \"\"hi\"\"\"", ',', '"')).isFalse();
        assertThat(DelimitedLine.hasOpenQuote("1,\"say \"\"hi", ',', '"')).isTrue();
    }

    @Test
    void quoteInsideUnquotedFieldIsLiteral() {
        assertThat(DelimitedLine.hasOpenQuote("aaa01,Smith,6'1\"", ',', '"')).isFalse();
        assertThat(DelimitedLine.countFields("aaa01,Smith 6'1\",x", ',', '"')).isEqualTo(3);
        assertThat(DelimitedLine.lastField("a,b\"c,d", ',', '"')).isEqualTo("d");
        assertThat(DelimitedLine.hasOpenQuote("aaa01,\"Smith", ',', '"')).isTrue();
    }

    @Test
    void lastFieldAndUnquote() {
        String record = "\"19010418\",\"Y,N\"";

        assertThat(DelimitedLine.lastField(record, ',', '"')).isEqualTo("\"Y,N\"");
        assertThat(DelimitedLine.unquote("\"Y,N\"", '"')).isEqualTo("Y,N");
        assertThat(DelimitedLine.unquote(" \"a \"\"b\"\"\" ", '"')).isEqualTo("a \"b\"");
        assertThat(DelimitedLine.lastField("no delimiter", ',', '"')).isEqualTo("no delimiter");
    }
}
