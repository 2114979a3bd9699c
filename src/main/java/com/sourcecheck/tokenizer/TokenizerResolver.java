package com.sourcecheck.tokenizer;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the tokenizer for a batching session.
 * Order: explicit adapter from the caller, then the identifier declared by the model card,
 * then the configured fallback encoding.
 */
@Component
public class TokenizerResolver {

    private static final Logger logger = LoggerFactory.getLogger(TokenizerResolver.class);

    private final EncodingRegistry registry;
    private final String fallbackEncoding;

    public TokenizerResolver(@Value("${sourcecheck.tokenizer.fallback-encoding:r50k_base}") String fallbackEncoding) {
        this.registry = Encodings.newDefaultEncodingRegistry();
        this.fallbackEncoding = fallbackEncoding;
    }

    /**
     * Resolves a tokenizer for a new session.
     *
     * @param explicit adapter supplied by the caller, may be null
     * @param modelCard model card whose tokenizer identifier is consulted, may be null
     * @return the resolved adapter
     * @throws TokenizerConfigurationException if nothing in the chain resolves
     */
    public TokenAdapter resolve(TokenAdapter explicit, ModelCard modelCard) {
        if (explicit != null) {
            logger.debug("Using caller supplied tokenizer: {}", explicit.name());
            return explicit;
        }

        if (modelCard != null && modelCard.getTokenizer() != null && !modelCard.getTokenizer().isBlank()) {
            Optional<TokenAdapter> declared = lookup(modelCard.getTokenizer());
            if (declared.isPresent()) {
                logger.info("Resolved tokenizer {} from model card: model={}",
                        declared.get().name(), modelCard.getModelName());
                return declared.get();
            }
            logger.warn("Model card tokenizer '{}' is not a known encoding or model, trying fallback '{}'",
                    modelCard.getTokenizer(), fallbackEncoding);
        }

        if (fallbackEncoding != null && !fallbackEncoding.isBlank()) {
            Optional<TokenAdapter> fallback = lookup(fallbackEncoding);
            if (fallback.isPresent()) {
                logger.debug("Using fallback tokenizer: {}", fallbackEncoding);
                return fallback.get();
            }
        }

        throw new TokenizerConfigurationException(String.format(
                "No tokenizer could be resolved (model card tokenizer=%s, fallback encoding=%s)",
                modelCard != null ? modelCard.getTokenizer() : null, fallbackEncoding));
    }

    public TokenAdapter resolveDefault() {
        return resolve(null, null);
    }

    /**
     * Looks an identifier up first as an encoding name, then as a model name.
     */
    Optional<TokenAdapter> lookup(String identifier) {
        String trimmed = identifier.trim();
        Optional<Encoding> encoding = registry.getEncoding(trimmed);
        if (encoding.isEmpty()) {
            encoding = registry.getEncodingForModel(trimmed);
        }
        return encoding.map(JtokkitTokenAdapter::new);
    }
}
