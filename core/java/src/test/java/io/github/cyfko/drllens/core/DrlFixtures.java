package io.github.cyfko.drllens.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads DRL documents from {@code src/test/resources/drl}.
 */
public final class DrlFixtures {

    private DrlFixtures() {
    }

    public static String load(String name) {
        try (InputStream in = DrlFixtures.class.getResourceAsStream("/drl/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Character offset of the first occurrence of {@code fragment} in {@code text}.
     */
    public static int offsetOf(String text, String fragment) {
        int index = text.indexOf(fragment);
        if (index < 0) {
            throw new IllegalArgumentException("Fragment not found: " + fragment);
        }
        return index;
    }
}
