package io.kestra.plugin.etl.graph;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

class AggregateSpecTest {
    @Test
    void parsesShorthand() {
        assertThat(AggregateSpec.parse("sum(amount)"), is(AggregateSpec.sum("amount")));
        assertThat(AggregateSpec.parse(" avg( amount ) "), is(AggregateSpec.average("amount")));
        assertThat(AggregateSpec.parse("COUNT()"), is(AggregateSpec.count()));
        assertThat(AggregateSpec.parse("count(region)").inputColumn(), is("region"));
    }

    @Test
    void rendersShorthand() {
        assertThat(AggregateSpec.max("amount").toString(), is("max(amount)"));
        assertThat(AggregateSpec.count().toString(), is("count()"));
    }

    @Test
    void bindsFromMap() {
        AggregateSpec spec = AggregateSpec.from(Map.of("kind", "min", "column", "price"));

        assertThat(spec, is(AggregateSpec.min("price")));
        assertThat(AggregateSpec.from(null), is(nullValue()));
    }

    @Test
    void rejectsMalformedDefinitions() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AggregateSpec.parse("sum"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AggregateSpec.parse("median(x)"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AggregateSpec.parse("sum()"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AggregateSpec.from(42));
    }
}
