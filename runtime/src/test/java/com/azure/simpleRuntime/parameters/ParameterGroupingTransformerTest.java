package com.azure.simpleRuntime.parameters;

import com.azure.simpleRuntime.operation.GroupedParameterSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;

class ParameterGroupingTransformerTest {

    private ParameterGroupingTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new ParameterGroupingTransformer(new ObjectMapper());
    }

    @Test
    void absentSourceGivesAbsentTarget() {
        GroupedParameterSpec spec = GroupedParameterSpec.of("nextOptions", ListNextOptions.class, "top", "filter");

        assertNull(transformer.transform(null, spec));
        assertNull(transformer.transform(null, spec, ListNextOptions.class));
    }

    @Test
    void copiesOnlyNamedFields() {
        ListOptions source = new ListOptions();
        source.setTop(25);
        source.setFilter("name eq 'a'");
        source.setExpand("children");

        GroupedParameterSpec spec = GroupedParameterSpec.of("nextOptions", ListNextOptions.class, "top");
        ListNextOptions target = transformer.transform(source, spec, ListNextOptions.class);

        assertThat(target.getTop()).isEqualTo(25);
        assertThat(target.getFilter()).isNull();
    }

    @Test
    void copiesEveryTargetPropertyWhenSpecListsNone() {
        ListOptions source = new ListOptions();
        source.setTop(5);
        source.setFilter("kind eq 'x'");
        source.setExpand("children");

        Object target = transformer.transform(source, GroupedParameterSpec.of("nextOptions", ListNextOptions.class));

        assertThat(target).isInstanceOf(ListNextOptions.class);
        ListNextOptions next = (ListNextOptions) target;
        assertThat(next.getTop()).isEqualTo(5);
        assertThat(next.getFilter()).isEqualTo("kind eq 'x'");
    }

    @Test
    void buildsFreshInstanceAndLeavesUnsetFieldsAtDefault() {
        ListNextOptions source = new ListNextOptions();
        source.setFilter("a");

        ListNextOptions target = transformer.transform(source,
            GroupedParameterSpec.of("nextOptions", ListNextOptions.class, "top", "filter"), ListNextOptions.class);

        assertNotSame(source, target);
        assertThat(target.getFilter()).isEqualTo("a");
        assertThat(target.getTop()).isNull();
    }
}
