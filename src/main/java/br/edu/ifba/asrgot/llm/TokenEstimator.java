package br.edu.ifba.asrgot.llm;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prompt sizing for model calls.
 *
 * <p>Exact counts and token-aligned chunks come from jtokkit's cl100k_base encoding. If the
 * encoding cannot be loaded every operation falls back to 4 characters per token.</p>
 */
public final class TokenEstimator {

    private static final Logger logger = LoggerFactory.getLogger(TokenEstimator.class);

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static final class EncodingHolder {
        static final Optional<Encoding> ENCODING = load();

        private static Optional<Encoding> load() {
            try {
                Encoding encoding = Encodings.newLazyEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
                logger.debug("Loaded cl100k_base encoding for prompt sizing");
                return Optional.of(encoding);
            } catch (RuntimeException e) {
                logger.warn("cl100k_base encoding unavailable, sizing prompts by characters: {}", e.getMessage());
                return Optional.empty();
            }
        }
    }

    /**
     * Token count of {@code text}; 0 for null or empty text.
     */
    public static int estimateTokens(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return EncodingHolder.ENCODING
            .map(encoding -> encoding.countTokens(text))
            .orElseGet(() -> estimateTokensApproximate(text));
    }

    /**
     * {@code ceil(length / 4)}. This is the estimate recorded by the scheduler.
     */
    public static int estimateTokensApproximate(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Splits text into consecutive pieces of at most {@code maxTokens} tokens, without overlap.
     *
     * @throws IllegalArgumentException if maxTokens is not positive
     */
    @NotNull
    public static List<String> chunk(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        return EncodingHolder.ENCODING
            .map(encoding -> chunkByTokens(encoding, text, maxTokens))
            .orElseGet(() -> chunkByCharacters(text, maxTokens * CHARS_PER_TOKEN));
    }

    private static List<String> chunkByTokens(Encoding encoding, String text, int maxTokens) {
        IntArrayList tokens = encoding.encode(text);
        List<String> chunks = new ArrayList<>((tokens.size() + maxTokens - 1) / maxTokens);
        IntArrayList window = new IntArrayList(maxTokens);
        for (int i = 0; i < tokens.size(); i++) {
            window.add(tokens.get(i));
            if (window.size() == maxTokens || i == tokens.size() - 1) {
                chunks.add(encoding.decode(window));
                window = new IntArrayList(maxTokens);
            }
        }
        return chunks;
    }

    private static List<String> chunkByCharacters(String text, int maxChars) {
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < text.length(); start += maxChars) {
            chunks.add(text.substring(start, Math.min(start + maxChars, text.length())));
        }
        return chunks;
    }
}
