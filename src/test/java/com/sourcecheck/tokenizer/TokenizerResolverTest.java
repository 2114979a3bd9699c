package com.sourcecheck.tokenizer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenizerResolverTest {

    private TokenizerResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TokenizerResolver("r50k_base");
    }

    @Test
    void testResolve_ExplicitTokenizerWins() {
        // Given: Caller supplies a tokenizer and the model card declares another one
        TokenAdapter explicit = new WhitespaceTokenAdapter();
        ModelCard card = new ModelCard("some-model", "cl100k_base", 2048);

        // When: Resolving
        TokenAdapter resolved = resolver.resolve(explicit, card);

        // Then: The caller's instance is returned as-is
        assertThat(resolved).isSameAs(explicit);
    }

    @Test
    void testResolve_ModelCardEncodingName() {
        TokenAdapter resolved = resolver.resolve(null, new ModelCard("m", "cl100k_base", null));

        assertThat(resolved.name()).isEqualTo("cl100k_base");
    }

    @Test
    void testResolve_ModelCardModelName() {
        // Given: Identifier is a model name rather than an encoding name
        ModelCard card = new ModelCard("gpt-4", "gpt-4", 8192);

        // When/Then: Resolved through the model registry
        assertThat(resolver.resolve(null, card).name()).isEqualTo("cl100k_base");
    }

    @Test
    void testResolve_UnknownIdentifierFallsBack() {
        // Given: Model card names a tokenizer nothing knows about
        ModelCard card = new ModelCard("local-model", "llmware/bling-tokenizer", 2048);

        // When: Resolving
        TokenAdapter resolved = resolver.resolve(null, card);

        // Then: The configured fallback encoding is used
        assertThat(resolved.name()).isEqualTo("r50k_base");
    }

    @Test
    void testResolve_NothingResolvableThrows() {
        TokenizerResolver misconfigured = new TokenizerResolver("no_such_encoding");

        assertThatThrownBy(misconfigured::resolveDefault)
                .isInstanceOf(TokenizerConfigurationException.class)
                .hasMessageContaining("no_such_encoding");
    }

    @Test
    void testResolve_ReturnsIndependentAdaptersPerCall() {
        TokenAdapter first = resolver.resolveDefault();
        TokenAdapter second = resolver.resolveDefault();

        assertThat(first).isNotSameAs(second);
        assertThat(first.name()).isEqualTo(second.name());
    }

    @Test
    void testModelCard_ReadsSnakeCaseJson() throws Exception {
        String json = "{\"model_name\":\"bling\",\"tokenizer\":\"p50k_base\",\"max_input_len\":2048,\"temperature\":0.3}";

        ModelCard card = new ObjectMapper().readValue(json, ModelCard.class);

        assertThat(card.getModelName()).isEqualTo("bling");
        assertThat(card.getTokenizer()).isEqualTo("p50k_base");
        assertThat(card.getMaxInputLen()).isEqualTo(2048);
    }
}
