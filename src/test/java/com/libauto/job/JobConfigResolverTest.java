package com.libauto.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobConfigResolverTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobConfigResolver resolver = new JobConfigResolver(objectMapper);

    @Test
    void nullBecomesEmptyObject() {
        assertThat(resolver.resolve(null).isEmpty()).isTrue();
    }

    @Test
    void objectIsCopied() {
        ObjectNode stored = objectMapper.createObjectNode().put("batchSize", 50);

        ObjectNode resolved = resolver.resolve(stored);
        resolved.put("batchSize", 10);

        assertThat(stored.get("batchSize").asInt()).isEqualTo(50);
    }

    @Test
    void jsonStringIsParsed() {
        assertThat(resolver.resolve("{\"a\":1}").get("a").asInt()).isEqualTo(1);
    }

    @Test
    void jsonStringStoredAsTextNodeIsParsed() {
        ObjectNode resolved = resolver.resolve(TextNode.valueOf("{\"recipients\":[\"x@y.z\"]}"));

        assertThat(resolved.get("recipients").get(0).asText()).isEqualTo("x@y.z");
    }

    @Test
    void listIsWrappedUnderValues() {
        ObjectNode resolved = resolver.resolve(List.of(1, 2));

        assertThat(resolved.get("values").size()).isEqualTo(2);
        assertThat(resolved.get("values").get(1).asInt()).isEqualTo(2);
    }

    @Test
    void unparseableStringBecomesEmptyObject() {
        assertThat(resolver.resolve("{bad").isEmpty()).isTrue();
    }

    @Test
    void scalarsBecomeEmptyObject() {
        assertThat(resolver.resolve(42).isEmpty()).isTrue();
        assertThat(resolver.resolve("\"just text\"").isEmpty()).isTrue();
        assertThat(resolver.resolve("   ").isEmpty()).isTrue();
    }

    @Test
    void mapIsConverted() {
        ObjectNode resolved = resolver.resolve(Map.of("finePerDay", 2.5));

        assertThat(resolved.get("finePerDay").asDouble()).isEqualTo(2.5);
    }
}
